package io.stylusport.anchor.normalize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class NormalizedAccountStruct {
    private final String name;
    private final String visibility;
    private final List<NormalizedAccountField> fields = new ArrayList<>();

    public NormalizedAccountStruct(String name, String visibility) {
        this.name = Objects.requireNonNull(name, "name");
        this.visibility = Objects.requireNonNull(visibility, "visibility");
    }

    public String getName() {
        return name;
    }

    public String getVisibility() {
        return visibility;
    }

    public List<NormalizedAccountField> getFields() {
        return Collections.unmodifiableList(fields);
    }

    /** Doc comments are not collected from the source, so this is always empty. */
    public Optional<String> getDocumentation() {
        return Optional.empty();
    }

    public Optional<NormalizedAccountField> findField(String fieldName) {
        return fields.stream().filter(f -> f.getName().equals(fieldName)).findFirst();
    }

    void addField(NormalizedAccountField field) {
        fields.add(Objects.requireNonNull(field, "field"));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof NormalizedAccountStruct)) {
            return false;
        }
        NormalizedAccountStruct other = (NormalizedAccountStruct) obj;
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
        return "NormalizedAccountStruct{" + name + ", fields=" + fields + "}";
    }
}
