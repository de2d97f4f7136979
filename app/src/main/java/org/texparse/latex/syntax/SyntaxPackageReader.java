package org.texparse.latex.syntax;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import org.texparse.latex.Lexeme;
import org.texparse.latex.Mode;
import org.texparse.latex.Operation;

/**
 * Reads a {@link SyntaxPackage} from JSON:
 *
 * <pre>
 * {
 *   "symbols": [ { "pattern": "{#1}", "lexeme": "BRACKETS", "parameters": [ {} ] } ],
 *   "commands": [ { "name": "section", "pattern": "#1", "modes": { "TEXT": true },
 *                   "parameters": [ {} ] } ],
 *   "environments": [ { "name": "document" } ]
 * }
 * </pre>
 */
public class SyntaxPackageReader {
    public static final String BASE_PACKAGE = "/org/texparse/latex/syntax/base.json";

    private final Gson gson = new GsonBuilder()
        .registerTypeAdapter(Operation.class, new OperationAdapter())
        .create();

    /*
     * JSON shapes
     */
    static class ItemJson {
        String lexeme;
        Map<String, Boolean> modes;
    }

    static final class ParameterJson extends ItemJson {
        List<Operation> operations;
    }

    static class SymbolJson extends ItemJson {
        String pattern;
        List<ParameterJson> parameters;
        List<Operation> operations;
    }

    static final class CommandJson extends SymbolJson {
        String name;
    }

    static final class EnvironmentJson extends ItemJson {
        String name;
    }

    static final class PackageJson {
        List<SymbolJson> symbols;
        List<CommandJson> commands;
        List<EnvironmentJson> environments;
    }

    public SyntaxPackage read(Reader reader) {
        PackageJson json = gson.fromJson(reader, PackageJson.class);
        if (json == null) {
            throw new JsonParseException("empty syntax package");
        }
        try {
            return new SyntaxPackage(
                elements(json.symbols, "symbol").stream().map(this::symbol).toList(),
                elements(json.commands, "command").stream().map(this::command).toList(),
                elements(json.environments, "environment").stream().map(this::environment).toList()
            );
        } catch (IllegalArgumentException e) {
            throw new JsonParseException("invalid syntax definition: " + e.getMessage(), e);
        }
    }

    public SyntaxPackage read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public SyntaxPackage readResource(String name) throws IOException {
        InputStream stream = SyntaxPackageReader.class.getResourceAsStream(name);
        if (stream == null) {
            throw new IOException("no such resource: " + name);
        }
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public SyntaxPackage readBase() throws IOException {
        return readResource(BASE_PACKAGE);
    }

    /* Conversion */

    private SymbolSyntax symbol(SymbolJson json) {
        return new SymbolSyntax(
            json.pattern, lexeme(json.lexeme), modes(json.modes),
            parameters(json.parameters), elements(json.operations, "operation"));
    }

    private CommandSyntax command(CommandJson json) {
        return new CommandSyntax(
            json.name, json.pattern, lexeme(json.lexeme), modes(json.modes),
            parameters(json.parameters), elements(json.operations, "operation"));
    }

    private EnvironmentSyntax environment(EnvironmentJson json) {
        return new EnvironmentSyntax(json.name, lexeme(json.lexeme), modes(json.modes));
    }

    private List<ParameterSyntax> parameters(List<ParameterJson> json) {
        var parameters = new ArrayList<ParameterSyntax>();
        for (ParameterJson parameter : elements(json, "parameter")) {
            parameters.add(new ParameterSyntax(
                lexeme(parameter.lexeme), modes(parameter.modes), elements(parameter.operations, "operation")));
        }
        return parameters;
    }

    private static Lexeme lexeme(String name) {
        return name == null ? null : enumValue(Lexeme.class, name);
    }

    private static Map<Mode, Boolean> modes(Map<String, Boolean> json) {
        var modes = new EnumMap<Mode, Boolean>(Mode.class);
        if (json != null) {
            json.forEach((name, value) -> modes.put(enumValue(Mode.class, name), value));
        }
        return modes;
    }

    static <E extends Enum<E>> E enumValue(Class<E> type, String name) {
        try {
            return Enum.valueOf(type, name);
        } catch (IllegalArgumentException e) {
            throw new JsonParseException("unknown " + type.getSimpleName() + " " + name, e);
        }
    }

    // A missing list is empty; a null inside one is malformed.
    private static <T> List<T> elements(List<T> list, String what) {
        if (list == null) {
            return List.of();
        }
        if (list.contains(null)) {
            throw new JsonParseException("null " + what + " entry");
        }
        return list;
    }
}
