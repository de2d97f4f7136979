package org.texparse.latex.syntax;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;
import java.util.Map;

import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import org.texparse.latex.Lexeme;
import org.texparse.latex.Mode;
import org.texparse.latex.ModeState;
import org.texparse.latex.Operation;

class SyntaxPackageReaderTest {
    private final SyntaxPackageReader reader = new SyntaxPackageReader();

    @Test void readsDefinitions() {
        String json = """
            {
              "symbols": [
                { "pattern": "$#1$", "lexeme": "INLINE_EQUATION", "modes": { "MATH": false },
                  "parameters": [ { "operations": [
                    { "directive": "BEGIN", "operand": "GROUP" },
                    { "directive": "BEGIN", "operand": "MATH" } ] } ],
                  "operations": [ { "directive": "END", "operand": "GROUP" } ] }
              ],
              "commands": [
                { "name": "label", "pattern": "#1", "parameters": [ { "lexeme": "LABEL" } ] }
              ],
              "environments": [ { "name": "document", "modes": { "TEXT": true } } ]
            }
            """;

        SyntaxPackage syntaxPackage = reader.read(new StringReader(json));

        SymbolSyntax math = syntaxPackage.symbols().get(0);
        assertEquals("$#1$", math.pattern());
        assertEquals(Lexeme.INLINE_EQUATION, math.lexeme().orElseThrow());
        assertEquals(Map.of(Mode.MATH, false), math.modes());
        assertEquals(List.of(Operation.beginGroup(), Operation.begin(Mode.MATH)),
            math.parameter(0).operations());
        assertEquals(List.of(Operation.endGroup()), math.operations());

        CommandSyntax label = syntaxPackage.commands().get(0);
        assertEquals("label", label.name());
        assertEquals(Lexeme.LABEL, label.parameter(0).lexeme().orElseThrow());

        EnvironmentSyntax document = syntaxPackage.environments().get(0);
        assertEquals("document", document.name());
        assertTrue(document.appliesTo(new ModeState()));
    }

    @Test void missingSectionsAreEmpty() {
        SyntaxPackage syntaxPackage = reader.read(new StringReader("{}"));

        assertEquals(new SyntaxPackage(null, null, null), syntaxPackage);
    }

    @Test void rejectsUnknownNames() {
        assertThrows(JsonParseException.class, () -> reader.read(new StringReader(
            "{ \"symbols\": [ { \"pattern\": \"x\", \"lexeme\": \"NOPE\" } ] }")));
        assertThrows(JsonParseException.class, () -> reader.read(new StringReader(
            "{ \"commands\": [ { \"name\": \"x\", \"modes\": { \"COLOR\": true } } ] }")));
        assertThrows(JsonParseException.class, () -> reader.read(new StringReader(
            "{ \"symbols\": [ { \"pattern\": \"x\", \"operations\": [ { \"directive\": \"BEGIN\" } ] } ] }")));
    }

    @Test void rejectsNullEntries() {
        assertThrows(JsonParseException.class, () -> reader.read(new StringReader(
            "{ \"symbols\": [ null ] }")));
        assertThrows(JsonParseException.class, () -> reader.read(new StringReader(
            "{ \"commands\": [ { \"name\": \"x\" }, null ] }")));
        assertThrows(JsonParseException.class, () -> reader.read(new StringReader(
            "{ \"environments\": [ null ] }")));
        assertThrows(JsonParseException.class, () -> reader.read(new StringReader(
            "{ \"symbols\": [ { \"pattern\": \"x\", \"operations\": [ null ] } ] }")));
        assertThrows(JsonParseException.class, () -> reader.read(new StringReader(
            "{ \"symbols\": [ { \"pattern\": \"{#1}\", \"parameters\": [ null ] } ] }")));
        assertThrows(JsonParseException.class, () -> reader.read(new StringReader(
            "{ \"symbols\": [ { \"pattern\": \"{#1}\", \"parameters\": [ { \"operations\": [ null ] } ] } ] }")));
        assertThrows(JsonParseException.class, () -> reader.read(new StringReader(
            "{ \"symbols\": [ { \"pattern\": \"x\", \"modes\": { \"MATH\": null } } ] }")));
    }

    @Test void rejectsBrokenPatterns() {
        assertThrows(JsonParseException.class, () -> reader.read(new StringReader(
            "{ \"symbols\": [ { \"pattern\": \"{#2}\", \"parameters\": [ {} ] } ] }")));
    }

    @Test void operationsSerializeBack() {
        var gson = new GsonBuilder().registerTypeAdapter(Operation.class, new OperationAdapter()).create();

        assertEquals(
            JsonParser.parseString("{ \"directive\": \"END\", \"operand\": \"GROUP\" }"),
            gson.toJsonTree(Operation.endGroup()));
        assertEquals(
            JsonParser.parseString("{ \"directive\": \"BEGIN\", \"operand\": \"TABLE\" }"),
            gson.toJsonTree(Operation.begin(Mode.TABLE)));
    }

    @Test void basePackageLoads() throws IOException {
        SyntaxPackage base = reader.readBase();
        var catalog = new SyntaxCatalog();
        catalog.load("base", base);

        var text = new ModeState();
        assertFalse(catalog.commandsFor(text, "author").isEmpty());
        assertFalse(catalog.environmentsFor(text, "document").isEmpty());
        assertFalse(catalog.symbolsFor(text, "{").isEmpty());
        assertTrue(catalog.symbolsFor(text, "^").isEmpty());
        assertFalse(catalog.symbolsFor(new ModeState(Map.of(Mode.MATH, true)), "^").isEmpty());
    }

    @Test void missingResourceFails() {
        assertThrows(IOException.class, () -> reader.readResource("/no/such/package.json"));
    }
}
