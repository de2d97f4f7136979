package org.texparse;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.*;

import com.google.gson.GsonBuilder;

import org.texparse.latex.Lexeme;
import org.texparse.latex.parser.LatexParser;
import org.texparse.latex.syntax.SymbolSyntax;
import org.texparse.latex.syntax.SyntaxCatalog;
import org.texparse.latex.syntax.SyntaxPackage;
import org.texparse.latex.tree.LatexToken;
import org.texparse.parser.Position;
import org.texparse.syntax.SyntaxTree;

class AppTest {
    private static SyntaxTree<LatexToken> parse(String source) {
        var catalog = new SyntaxCatalog();
        catalog.load("test", new SyntaxPackage(
            List.of(SymbolSyntax.of("\\\\", null), SymbolSyntax.of("x", Lexeme.LETTER)), null, null));
        return new LatexParser(catalog).parseTree(source);
    }

    @Test void jsonDump() {
        var tree = parse("\\\\ x");

        Map<String, Object> symbol = new LinkedHashMap<>();
        symbol.put("kind", "SYMBOL");
        symbol.put("offset", 0);
        symbol.put("length", 2);
        symbol.put("text", "\\\\");

        Map<String, Object> space = new LinkedHashMap<>();
        space.put("kind", "SPACE");
        space.put("lexeme", "SPACE");
        space.put("offset", 2);
        space.put("length", 1);
        space.put("lineBreaks", 0);
        space.put("text", " ");

        Map<String, Object> letter = new LinkedHashMap<>();
        letter.put("kind", "SYMBOL");
        letter.put("lexeme", "LETTER");
        letter.put("offset", 3);
        letter.put("length", 1);
        letter.put("text", "x");

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("kind", "DOCUMENT");
        document.put("offset", 0);
        document.put("length", 4);
        document.put("text", "\\\\ x");
        document.put("children", List.of(symbol, space, letter));

        var gson = new GsonBuilder().setPrettyPrinting().create();

        String actualJson = TreeJson.toJson(tree.root());
        String expectedJson = gson.toJson(document);

        assertEquals(expectedJson, actualJson);
    }

    @Test void printedTree() {
        String source = "\\\\\n\nx";
        var tree = parse(source);

        String expected = String.join("\n",
            "DOCUMENT @ 1:1..3:1",
            "  SYMBOL (\"\\\\\") @ 1:1..1:2",
            "  SPACE PARAGRAPH_SEPARATOR (breaks=2) @ 1:3..2:1",
            "  SYMBOL LETTER (\"x\") @ 3:1..3:1",
            "");

        assertEquals(expected, new TreePrinter(source).print(tree.root()));
    }

    @Test void spans() {
        var index = SpanUtils.lineIndex("ab\ncd\n");

        assertEquals(List.of(0, 3, 6), index);
        assertEquals(new Position(1, 1), SpanUtils.locate(0, index));
        assertEquals(new Position(1, 3), SpanUtils.locate(2, index));
        assertEquals(new Position(2, 1), SpanUtils.locate(3, index));
        assertEquals(new Position(3, 1), SpanUtils.locate(6, index));
        assertEquals("1:2..2:1", SpanUtils.formatSpan(1, 3, index));
        assertEquals("2:2..2:2", SpanUtils.formatSpan(4, 0, index));
    }
}
