package io.stylusport.anchor.normalize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class NormalizedRawAccount {
    private final String name;
    private final String visibility;
    private final List<NormalizedRawField> fields = new ArrayList<>();

    public NormalizedRawAccount(String name, String visibility) {
        this.name = Objects.requireNonNull(name, "name");
        this.visibility = Objects.requireNonNull(visibility, "visibility");
    }

    public String getName() {
        return name;
    }

    public String getVisibility() {
        return visibility;
    }

    public List<NormalizedRawField> getFields() {
        return Collections.unmodifiableList(fields);
    }

    /** Doc comments are not collected from the source, so this is always empty. */
    public Optional<String> getDocumentation() {
        return Optional.empty();
    }

    public Optional<NormalizedRawField> findField(String fieldName) {
        return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
    }

    void addField(NormalizedRawField field) {
        fields.add(Objects.requireNonNull(field, "field"));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof NormalizedRawAccount)) {
            return false;
        }
        NormalizedRawAccount other = (NormalizedRawAccount) obj;
        return name.equals(other.name)
                && visibility.equals(other.visibility)
                && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, visibility, fields);
    }

    @Override
    public String toString() {
        return "NormalizedRawAccount{" + name + ", fields=" + fields + "}";
    }
}
