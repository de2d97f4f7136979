package org.texparse;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import org.texparse.latex.tree.CommandToken;
import org.texparse.latex.tree.EnvironmentToken;
import org.texparse.latex.tree.LatexToken;
import org.texparse.latex.tree.ParameterToken;
import org.texparse.latex.tree.SourceToken;
import org.texparse.latex.tree.SpaceToken;

/** JSON dump of a token tree. */
public class TreeJson {
    private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    public static String toJson(LatexToken token) {
        return gson.toJson(toJsonTree(token));
    }

    public static JsonObject toJsonTree(LatexToken token) {
        var json = new JsonObject();
        json.addProperty("kind", token.kind().name());
        token.lexeme().ifPresent(lexeme -> json.addProperty("lexeme", lexeme.name()));
        json.addProperty("offset", token.sourceOffset());
        json.addProperty("length", token.sourceLength());

        if (token instanceof CommandToken command) {
            json.addProperty("name", command.name());
        } else if (token instanceof EnvironmentToken environment) {
            json.addProperty("name", environment.name());
        } else if (token instanceof ParameterToken parameter) {
            json.addProperty("brackets", parameter.hasBrackets());
        } else if (token instanceof SpaceToken space) {
            json.addProperty("lineBreaks", space.lineBreakCount());
        } else if (token instanceof SourceToken source) {
            json.addProperty("source", source.source());
        }
        json.addProperty("text", token.toSource());

        if (token.childCount() > 0) {
            var children = new JsonArray();
            for (LatexToken child : token.children()) {
                children.add(toJsonTree(child));
            }
            json.add("children", children);
        }
        return json;
    }
}
