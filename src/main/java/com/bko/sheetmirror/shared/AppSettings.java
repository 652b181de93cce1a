package com.bko.sheetmirror.shared;

public record AppSettings(GoogleSettings google, TransportSettings transport) {
    public boolean isGoogleConfigured() {
        return google != null && google.isConfigured();
    }
}
