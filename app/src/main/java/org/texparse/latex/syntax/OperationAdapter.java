package org.texparse.latex.syntax;

import java.lang.reflect.Type;

import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;

import org.texparse.latex.Directive;
import org.texparse.latex.Mode;
import org.texparse.latex.Operation;

/** {@code {"directive": "BEGIN", "operand": "MATH" | "GROUP"}} */
public class OperationAdapter implements JsonSerializer<Operation>, JsonDeserializer<Operation> {
    private static final String GROUP = "GROUP";

    @Override
    public Operation deserialize(JsonElement json, Type typeOfT, JsonDeserializationContext context)
            throws JsonParseException {
        if (!json.isJsonObject()) {
            throw new JsonParseException("operation must be an object: " + json);
        }
        JsonObject object = json.getAsJsonObject();
        Directive directive = SyntaxPackageReader.enumValue(
            Directive.class, requiredString(object, "directive"));
        String operand = requiredString(object, "operand");
        if (operand.equals(GROUP)) {
            return new Operation(directive, null);
        }
        return new Operation(directive, SyntaxPackageReader.enumValue(Mode.class, operand));
    }

    @Override
    public JsonElement serialize(Operation src, Type typeOfSrc, JsonSerializationContext context) {
        var object = new JsonObject();
        object.addProperty("directive", src.directive().name());
        object.addProperty("operand", src.isGroup() ? GROUP : src.mode().name());
        return object;
    }

    private static String requiredString(JsonObject object, String field) {
        JsonElement value = object.get(field);
        if (value == null || !value.isJsonPrimitive()) {
            throw new JsonParseException("operation needs a \"" + field + "\" string");
        }
        return value.getAsString();
    }
}
