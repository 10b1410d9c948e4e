package io.stylusport.anchor.model;

import java.util.Objects;

public record Parameter(String name, String type, boolean isContext) {

    public Parameter {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public static Parameter context(String name, String contextStruct) {
        return new Parameter(name, "Context<" + contextStruct + ">", true);
    }
}
