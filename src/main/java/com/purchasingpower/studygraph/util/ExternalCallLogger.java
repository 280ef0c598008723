package com.purchasingpower.studygraph.util;

import com.purchasingpower.studygraph.model.CallContext;
import com.purchasingpower.studygraph.model.ServiceType;
import org.slf4j.Logger;

/**
 * Starts {@link CallContext}s and prepares prompt, chunk and response text for log lines.
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    /**
     * @param subject tenant id for store calls, agent name for completion calls
     */
    public static CallContext startCall(ServiceType service, String operation, String subject, Logger logger) {
        return new CallContext(service, operation, subject, logger);
    }

    /**
     * Single-line preview of at most {@code maxLength} chars: line breaks become {@code ⏎} and a
     * surrogate pair is never cut in half.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        String flat = text.replace("\r\n", "⏎").replace('\n', '⏎').replace('\r', '⏎');
        if (flat.length() <= maxLength) {
            return flat;
        }
        int end = maxLength;
        if (end > 0 && Character.isHighSurrogate(flat.charAt(end - 1))) {
            end--;
        }
        return flat.substring(0, end) + "… (+" + (flat.length() - end) + " chars)";
    }
}
