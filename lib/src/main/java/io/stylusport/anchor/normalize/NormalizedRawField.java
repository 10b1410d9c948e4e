package io.stylusport.anchor.normalize;

import java.util.Objects;
import java.util.Optional;

public record NormalizedRawField(String name, String type, String visibility, String documentation) {

    public NormalizedRawField {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(visibility, "visibility");
    }

    public NormalizedRawField(String name, String type, String visibility) {
        this(name, type, visibility, null);
    }

    public Optional<String> documentationIfPresent() {
        return Optional.ofNullable(documentation);
    }
}
