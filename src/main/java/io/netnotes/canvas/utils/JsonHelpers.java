package io.netnotes.canvas.utils;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

public class JsonHelpers {

    private static JsonElement getElement(JsonObject json, String key){
        JsonElement element = json != null ? json.get(key) : null;
        return element != null && !element.isJsonNull() ? element : null;
    }

    public static double getDouble(JsonObject json, String key, double defaultValue){
        JsonElement element = getElement(json, key);
        if(element == null || !element.isJsonPrimitive()){
            return defaultValue;
        }
        try{
            return element.getAsDouble();
        }catch(NumberFormatException e){
            return defaultValue;
        }
    }

    public static int getInt(JsonObject json, String key, int defaultValue){
        JsonElement element = getElement(json, key);
        if(element == null || !element.isJsonPrimitive()){
            return defaultValue;
        }
        try{
            return element.getAsInt();
        }catch(NumberFormatException e){
            return defaultValue;
        }
    }

    public static boolean getBoolean(JsonObject json, String key, boolean defaultValue){
        JsonElement element = getElement(json, key);
        return element != null && element.isJsonPrimitive() ? element.getAsBoolean() : defaultValue;
    }

    public static String getString(JsonObject json, String key, String defaultValue){
        JsonElement element = getElement(json, key);
        return element != null && element.isJsonPrimitive() ? element.getAsString() : defaultValue;
    }

    public static JsonObject getObject(JsonObject json, String key){
        JsonElement element = getElement(json, key);
        return element != null && element.isJsonObject() ? element.getAsJsonObject() : null;
    }

    public static JsonArray getArray(JsonObject json, String key){
        JsonElement element = getElement(json, key);
        return element != null && element.isJsonArray() ? element.getAsJsonArray() : new JsonArray();
    }
}
