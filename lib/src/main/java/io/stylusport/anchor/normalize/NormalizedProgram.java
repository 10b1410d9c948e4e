package io.stylusport.anchor.normalize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of {@link Normalizer#normalize}. Only the normalizer mutates an instance, and only before
 * returning it; every accessor exposes read-only views.
 */
public final class NormalizedProgram {
    public static final String SCHEMA_VERSION = "1.0";

    private final String id;
    private final String name;
    private final List<NormalizedModule> modules = new ArrayList<>();
    private final List<NormalizedAccountStruct> accountStructs = new ArrayList<>();
    private final List<NormalizedRawAccount> rawAccounts = new ArrayList<>();
    private final List<ValidationIssue> validationIssues = new ArrayList<>();
    private SourceInfo sourceInfo;

    NormalizedProgram(String id, String name) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getSchemaVersion() {
        return SCHEMA_VERSION;
    }

    public List<NormalizedModule> getModules() {
        return Collections.unmodifiableList(modules);
    }

    public List<NormalizedAccountStruct> getAccountStructs() {
        return Collections.unmodifiableList(accountStructs);
    }

    public List<NormalizedRawAccount> getRawAccounts() {
        return Collections.unmodifiableList(rawAccounts);
    }

    /** Issues in the order the checks emitted them. */
    public List<ValidationIssue> getValidationIssues() {
        return Collections.unmodifiableList(validationIssues);
    }

    public Optional<SourceInfo> getSourceInfo() {
        return Optional.ofNullable(sourceInfo);
    }

    /** Doc comments are not collected from the source, so this is always empty. */
    public Optional<String> getDocumentation() {
        return Optional.empty();
    }

    public Optional<NormalizedAccountStruct> findAccountStruct(String structName) {
        return accountStructs.stream().filter(a -> a.getName().equals(structName)).findFirst();
    }

    public Optional<NormalizedRawAccount> findRawAccount(String accountName) {
        return rawAccounts.stream().filter(a -> a.getName().equals(accountName)).findFirst();
    }

    public Optional<NormalizedInstruction> findInstruction(String instructionName) {
        for (NormalizedModule module : modules) {
            Optional<NormalizedInstruction> found = module.findInstruction(instructionName);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    public long countIssues(ValidationIssue.Severity severity) {
        return validationIssues.stream().filter(issue -> issue.getSeverity() == severity).count();
    }

    public boolean hasErrors() {
        return countIssues(ValidationIssue.Severity.ERROR) > 0;
    }

    void addModule(NormalizedModule module) {
        modules.add(Objects.requireNonNull(module, "module"));
    }

    void addAccountStruct(NormalizedAccountStruct accountStruct) {
        accountStructs.add(Objects.requireNonNull(accountStruct, "accountStruct"));
    }

    void addRawAccount(NormalizedRawAccount rawAccount) {
        rawAccounts.add(Objects.requireNonNull(rawAccount, "rawAccount"));
    }

    void addValidationIssues(List<ValidationIssue> issues) {
        validationIssues.addAll(issues);
    }

    void setSourceInfo(SourceInfo sourceInfo) {
        this.sourceInfo = sourceInfo;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof NormalizedProgram)) {
            return false;
        }
        NormalizedProgram other = (NormalizedProgram) obj;
        return id.equals(other.id)
                && name.equals(other.name)
                && modules.equals(other.modules)
                && accountStructs.equals(other.accountStructs)
                && rawAccounts.equals(other.rawAccounts)
                && validationIssues.equals(other.validationIssues)
                && Objects.equals(sourceInfo, other.sourceInfo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, modules, accountStructs, rawAccounts, validationIssues, sourceInfo);
    }

    @Override
    public String toString() {
        return "NormalizedProgram{id="
                + id
                + ", name="
                + name
                + ", schemaVersion="
                + SCHEMA_VERSION
                + ", modules="
                + modules
                + ", accountStructs="
                + accountStructs
                + ", rawAccounts="
                + rawAccounts
                + ", validationIssues="
                + validationIssues
                + ", sourceInfo="
                + sourceInfo
                + "}";
    }
}
