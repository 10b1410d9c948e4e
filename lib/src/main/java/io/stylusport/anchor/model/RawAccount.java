package io.stylusport.anchor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** A {@code #[account]} struct describing persisted account data. */
public final class RawAccount {
    private final String name;
    private final String visibility;
    private final List<RawAccountField> fields = new ArrayList<>();

    public RawAccount(String name, String visibility) {
        this.name = Objects.requireNonNull(name, "name");
        this.visibility = Objects.requireNonNull(visibility, "visibility");
    }

    public String getName() {
        return name;
    }

    public String getVisibility() {
        return visibility;
    }

    public List<RawAccountField> getFields() {
        return Collections.unmodifiableList(fields);
    }

    public RawAccount addField(RawAccountField field) {
        fields.add(Objects.requireNonNull(field, "field"));
        return this;
    }

    public Optional<RawAccountField> findField(String fieldName) {
        return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
    }

    @Override
    public String toString() {
        return "RawAccount{" + AccountStruct.visibilityPrefix(visibility) + name + ", fields=" + fields + "}";
    }
}
