package com.bko.sheetmirror.model;

public enum Dimension {
    ROWS,
    COLUMNS
}
