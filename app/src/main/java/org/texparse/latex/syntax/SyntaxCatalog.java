package org.texparse.latex.syntax;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import org.texparse.latex.ModeState;

/**
 * Package-scoped definition store.
 *
 * <p>Priority is a total order: definitions of the most recently loaded
 * package come first, and inside one package the declaration order holds.
 * Loading must not overlap with parsing.
 */
public class SyntaxCatalog implements SyntaxRegistry {
    private static final Logger log = LogManager.getLogger("syntax");

    private record Entry<I>(String packageName, I item) {}

    private final Map<String, List<Entry<SymbolSyntax>>> symbols = new HashMap<>();
    private final Map<String, List<Entry<CommandSyntax>>> commands = new HashMap<>();
    private final Map<String, List<Entry<EnvironmentSyntax>>> environments = new HashMap<>();
    private final List<String> packageNames = new ArrayList<>();

    public void load(String packageName, SyntaxPackage syntaxPackage) {
        if (packageName == null || packageName.isEmpty()) {
            throw new IllegalArgumentException("package name is empty");
        }
        for (SymbolSyntax symbol : syntaxPackage.symbols()) {
            if (symbol.components().isEmpty()
                || symbol.components().get(0) instanceof PatternComponent.ParameterSlot) {
                throw new IllegalArgumentException(
                    "symbol pattern must start with source text: " + symbol.pattern());
            }
        }
        if (packageNames.contains(packageName)) {
            unload(packageName);
        }

        var packageCommands = new ArrayList<>(syntaxPackage.commands());
        var declared = packageCommands.stream().map(CommandSyntax::name).collect(Collectors.toSet());
        for (EnvironmentSyntax environment : syntaxPackage.environments()) {
            for (String name : List.of(environment.beginCommandName(), environment.endCommandName())) {
                if (declared.add(name)) {
                    packageCommands.add(CommandSyntax.of(name, ""));
                }
            }
        }

        prepend(symbols, packageName, syntaxPackage.symbols(), this::firstChar);
        prepend(commands, packageName, packageCommands, CommandSyntax::name);
        prepend(environments, packageName, syntaxPackage.environments(), EnvironmentSyntax::name);
        packageNames.add(packageName);
        log.info("loaded package " + packageName + ": "
            + syntaxPackage.symbols().size() + " symbols, "
            + packageCommands.size() + " commands, "
            + syntaxPackage.environments().size() + " environments");
    }

    /** Drops every definition of the package; false if it was not loaded. */
    public boolean unload(String packageName) {
        if (!packageNames.remove(packageName)) {
            return false;
        }
        remove(symbols, packageName);
        remove(commands, packageName);
        remove(environments, packageName);
        log.debug("unloaded package " + packageName);
        return true;
    }

    /** Loaded packages, oldest first. */
    public List<String> packageNames() {
        return List.copyOf(packageNames);
    }

    @Override
    public List<SymbolSyntax> symbolsFor(ModeState state, String firstChar) {
        return lookup(symbols, firstChar, state);
    }

    @Override
    public List<CommandSyntax> commandsFor(ModeState state, String name) {
        return lookup(commands, name, state);
    }

    @Override
    public List<EnvironmentSyntax> environmentsFor(ModeState state, String name) {
        return lookup(environments, name, state);
    }

    private String firstChar(SymbolSyntax symbol) {
        String pattern = symbol.pattern();
        return pattern.substring(0, Character.charCount(pattern.codePointAt(0)));
    }

    private static <I> void prepend(
        Map<String, List<Entry<I>>> index,
        String packageName,
        List<? extends I> items,
        Function<I, String> key
    ) {
        var grouped = new LinkedHashMap<String, List<Entry<I>>>();
        for (I item : items) {
            grouped.computeIfAbsent(key.apply(item), k -> new ArrayList<>())
                .add(new Entry<>(packageName, item));
        }
        grouped.forEach((k, entries) ->
            index.computeIfAbsent(k, unused -> new ArrayList<>()).addAll(0, entries));
    }

    private static <I> void remove(Map<String, List<Entry<I>>> index, String packageName) {
        index.values().forEach(entries -> entries.removeIf(entry -> entry.packageName().equals(packageName)));
        index.values().removeIf(List::isEmpty);
    }

    private static <I extends SyntaxItem> List<I> lookup(
        Map<String, List<Entry<I>>> index, String key, ModeState state
    ) {
        List<Entry<I>> entries = index.get(key);
        if (entries == null) {
            return List.of();
        }
        var result = new ArrayList<I>();
        for (Entry<I> entry : entries) {
            if (entry.item().appliesTo(state)) {
                result.add(entry.item());
            }
        }
        return result;
    }
}
