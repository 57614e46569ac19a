package com.delta.jobboard.crawl.util;

import java.io.PrintWriter;
import java.io.StringWriter;

public final class ErrorDetails {

    private ErrorDetails() {
    }

    public static String fullText(Throwable error) {
        if (error == null) {
            return "";
        }
        StringWriter writer = new StringWriter();
        try (PrintWriter printer = new PrintWriter(writer)) {
            error.printStackTrace(printer);
        }
        return writer.toString().trim();
    }
}
