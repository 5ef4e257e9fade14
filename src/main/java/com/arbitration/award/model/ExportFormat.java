package com.arbitration.award.model;

public enum ExportFormat {
    JSON,
    CSV,
    PRINT
}
