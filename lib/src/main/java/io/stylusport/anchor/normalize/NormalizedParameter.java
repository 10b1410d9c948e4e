package io.stylusport.anchor.normalize;

import java.util.Objects;

public record NormalizedParameter(String name, String type, boolean isContext) {

    public NormalizedParameter {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }
}
