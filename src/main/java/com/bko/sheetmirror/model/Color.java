package com.bko.sheetmirror.model;

// Components the server omits are zero.
public record Color(Float red, Float green, Float blue, Float alpha) {
    public static Color rgb(float red, float green, float blue) {
        return new Color(red, green, blue, null);
    }

    public static Color fromApi(com.google.api.services.sheets.v4.model.Color color) {
        if (color == null) {
            return null;
        }
        return new Color(orZero(color.getRed()), orZero(color.getGreen()), orZero(color.getBlue()), color.getAlpha());
    }

    public com.google.api.services.sheets.v4.model.Color toApi() {
        return new com.google.api.services.sheets.v4.model.Color()
                .setRed(red)
                .setGreen(green)
                .setBlue(blue)
                .setAlpha(alpha);
    }

    private static Float orZero(Float value) {
        return value == null ? 0f : value;
    }
}
