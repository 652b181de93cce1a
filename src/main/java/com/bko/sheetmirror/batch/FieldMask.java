package com.bko.sheetmirror.batch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

// Dotted paths of the fields whose proposed value differs from the known one.
public final class FieldMask {
    private final List<String> paths = new ArrayList<>();

    public boolean compare(String path, Object current, Object proposed) {
        if (Objects.equals(current, proposed)) {
            return false;
        }
        paths.add(path);
        return true;
    }

    public boolean isEmpty() {
        return paths.isEmpty();
    }

    public List<String> paths() {
        return Collections.unmodifiableList(paths);
    }

    @Override
    public String toString() {
        return String.join(",", paths);
    }
}
