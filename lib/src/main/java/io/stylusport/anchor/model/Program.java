package io.stylusport.anchor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Domain model extracted from one source file: program modules, account-validation structs and raw
 * account structs, each in declaration order.
 */
public final class Program {
    private final List<ProgramModule> modules = new ArrayList<>();
    private final List<AccountStruct> accountStructs = new ArrayList<>();
    private final List<RawAccount> rawAccounts = new ArrayList<>();
    private String sourcePath;

    public List<ProgramModule> getModules() {
        return Collections.unmodifiableList(modules);
    }

    public List<AccountStruct> getAccountStructs() {
        return Collections.unmodifiableList(accountStructs);
    }

    public List<RawAccount> getRawAccounts() {
        return Collections.unmodifiableList(rawAccounts);
    }

    public Optional<String> getSourcePath() {
        return Optional.ofNullable(sourcePath);
    }

    public Program setSourcePath(String sourcePath) {
        this.sourcePath = sourcePath;
        return this;
    }

    public Program addModule(ProgramModule module) {
        modules.add(Objects.requireNonNull(module, "module"));
        return this;
    }

    public Program addAccountStruct(AccountStruct accountStruct) {
        accountStructs.add(Objects.requireNonNull(accountStruct, "accountStruct"));
        return this;
    }

    public Program addRawAccount(RawAccount rawAccount) {
        rawAccounts.add(Objects.requireNonNull(rawAccount, "rawAccount"));
        return this;
    }

    public Optional<AccountStruct> findAccountStruct(String name) {
        return accountStructs.stream().filter(a -> a.getName().equals(name)).findFirst();
    }

    public Optional<RawAccount> findRawAccount(String name) {
        return rawAccounts.stream().filter(a -> a.getName().equals(name)).findFirst();
    }

    public Optional<Instruction> findInstruction(String name) {
        for (ProgramModule module : modules) {
            Optional<Instruction> found = module.findInstruction(name);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "Program{sourcePath="
                + sourcePath
                + ", modules="
                + modules
                + ", accountStructs="
                + accountStructs
                + ", rawAccounts="
                + rawAccounts
                + "}";
    }
}
