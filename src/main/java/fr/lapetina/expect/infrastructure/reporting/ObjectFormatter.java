package fr.lapetina.expect.infrastructure.reporting;

import fr.lapetina.expect.domain.assertion.Text;
import fr.lapetina.expect.domain.creating.Subject;
import fr.lapetina.expect.infrastructure.config.ExpectationConfig.FormatterConfig;

/**
 * Turns subjects and expected values into the text shown in a report.
 */
public final class ObjectFormatter {

    private static final String ELLIPSIS = "...";

    private final boolean showTypes;
    private final int maxStringLength;
    private final String notAvailablePrefix;

    public ObjectFormatter(FormatterConfig config) {
        this.showTypes = config.isShowTypes();
        this.maxStringLength = config.getMaxStringLength();
        this.notAvailablePrefix = config.getNotAvailablePrefix();
    }

    public String format(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Text) {
            return value.toString();
        }
        if (value instanceof Subject.NotAvailable) {
            return notAvailablePrefix + " " + ((Subject.NotAvailable) value).reason();
        }
        if (value instanceof String) {
            return "\"" + cut((String) value) + "\"";
        }
        if (value instanceof Character) {
            return "'" + value + "'";
        }
        if (value instanceof Class) {
            return ((Class<?>) value).getName();
        }
        if (value instanceof Throwable) {
            Throwable throwable = (Throwable) value;
            String message = throwable.getMessage();
            return throwable.getClass().getName() + (message != null ? ": \"" + cut(message) + "\"" : "");
        }
        String formatted = cut(String.valueOf(value));
        return showTypes ? formatted + "        (" + value.getClass().getName() + ")" : formatted;
    }

    private String cut(String text) {
        if (maxStringLength <= 0 || text.length() <= maxStringLength) {
            return text;
        }
        return text.substring(0, maxStringLength) + ELLIPSIS;
    }
}
