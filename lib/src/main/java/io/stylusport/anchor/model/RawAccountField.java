package io.stylusport.anchor.model;

import java.util.Objects;

public record RawAccountField(String name, String type, String visibility) {

    public RawAccountField {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(visibility, "visibility");
    }
}
