package com.company.fermentation.domain.enums;

import com.company.fermentation.exception.UnsupportedExportFormatException;

public enum ExportFormat {
    JSON,
    CSV;

    public static ExportFormat fromString(String format) {
        if (format != null) {
            for (ExportFormat value : values()) {
                if (value.name().equalsIgnoreCase(format)) {
                    return value;
                }
            }
        }
        throw new UnsupportedExportFormatException(format);
    }
}
