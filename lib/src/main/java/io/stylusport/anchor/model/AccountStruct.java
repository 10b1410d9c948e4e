package io.stylusport.anchor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** A {@code #[derive(Accounts)]} struct: the accounts an instruction expects, with their constraints. */
public final class AccountStruct {
    private final String name;
    private final String visibility;
    private final List<AccountField> fields = new ArrayList<>();

    public AccountStruct(String name, String visibility) {
        this.name = Objects.requireNonNull(name, "name");
        this.visibility = Objects.requireNonNull(visibility, "visibility");
    }

    public String getName() {
        return name;
    }

    public String getVisibility() {
        return visibility;
    }

    public List<AccountField> getFields() {
        return Collections.unmodifiableList(fields);
    }

    public AccountStruct addField(AccountField field) {
        fields.add(Objects.requireNonNull(field, "field"));
        return this;
    }

    public Optional<AccountField> findField(String fieldName) {
        return fields.stream().filter(f -> f.getName().equals(fieldName)).findFirst();
    }

    @Override
    public String toString() {
        return "AccountStruct{" + visibilityPrefix(visibility) + name + ", fields=" + fields + "}";
    }

    static String visibilityPrefix(String visibility) {
        return visibility.isEmpty() ? "" : visibility + " ";
    }
}
