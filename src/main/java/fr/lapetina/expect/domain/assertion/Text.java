package fr.lapetina.expect.domain.assertion;

import java.util.Objects;

/**
 * Raw text used as a representation; printed as is, without the quotes strings get.
 */
public record Text(String value) {

    public Text {
        Objects.requireNonNull(value, "Text value is required");
    }

    @Override
    public String toString() {
        return value;
    }
}
