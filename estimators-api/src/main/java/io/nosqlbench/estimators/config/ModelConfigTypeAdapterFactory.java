package io.nosqlbench.estimators.config;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import io.nosqlbench.estimators.pipeline.PipelineConfig;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.lang.reflect.Modifier;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Gson TypeAdapterFactory for polymorphic {@link ModelConfig} serialization.
 *
 * <p>Every config is written with a leading {@code "type"} field holding its
 * {@link ModelConfig#modelType()}, followed by its own snake_case fields:
 *
 * <pre>{@code
 * {
 *   "type": "truncated_svd",
 *   "rank": 2
 * }
 * }</pre>
 *
 * <h2>Reading</h2>
 *
 * <ul>
 *   <li>Requested as {@link ModelConfig} (or a map or list of them): the
 *       {@code "type"} field is required and selects the registered class.</li>
 *   <li>Requested as a concrete config class: {@code "type"} may be omitted;
 *       when it names a registered type, that type must be the requested class.</li>
 * </ul>
 *
 * <p>Types are registered with {@link #registerType}. Writing a config also
 * registers its class under its model type, so anything written by this
 * factory can be read back.
 */
public final class ModelConfigTypeAdapterFactory implements TypeAdapterFactory {

    /** JSON field naming the model type. */
    public static final String TYPE_FIELD = "type";

    private final Map<String, Class<? extends ModelConfig>> typeToClass = new ConcurrentHashMap<>();

    private ModelConfigTypeAdapterFactory() {
    }

    /**
     * Creates a factory with the config types of this module registered.
     *
     * @return a configured factory
     */
    public static ModelConfigTypeAdapterFactory create() {
        ModelConfigTypeAdapterFactory factory = new ModelConfigTypeAdapterFactory();
        factory.registerType(PipelineConfig.MODEL_TYPE, PipelineConfig.class);
        return factory;
    }

    /**
     * Registers a config class under its model type. Registering the same
     * pair twice is a no-op.
     *
     * @param typeName the model type
     * @param configClass the concrete config class
     * @throws IllegalArgumentException if the type is registered to another class
     */
    public void registerType(String typeName, Class<? extends ModelConfig> configClass) {
        Class<? extends ModelConfig> existing = typeToClass.putIfAbsent(typeName, configClass);
        if (existing != null && existing != configClass) {
            throw new IllegalArgumentException(
                "Type '" + typeName + "' is already registered to " + existing.getName());
        }
    }

    /**
     * @return the registered model types, sorted
     */
    public Set<String> registeredTypes() {
        return new TreeSet<>(typeToClass.keySet());
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        Class<? super T> requested = type.getRawType();
        if (!ModelConfig.class.isAssignableFrom(requested)) {
            return null;
        }
        boolean concrete = !requested.isInterface() && !Modifier.isAbstract(requested.getModifiers());

        return new TypeAdapter<T>() {
            @Override
            public void write(JsonWriter out, T value) throws IOException {
                if (value == null) {
                    out.nullValue();
                    return;
                }
                ModelConfig config = (ModelConfig) value;
                String typeName = config.modelType();
                registerType(typeName, config.getClass());

                TypeAdapter<T> delegate = (TypeAdapter<T>) gson.getDelegateAdapter(
                    ModelConfigTypeAdapterFactory.this, TypeToken.get(value.getClass()));

                // Lenient round trip keeps NaN and Infinity intact
                StringWriter buffer = new StringWriter();
                JsonWriter lenientWriter = new JsonWriter(buffer);
                lenientWriter.setLenient(true);
                lenientWriter.setSerializeNulls(false);
                delegate.write(lenientWriter, value);
                lenientWriter.close();
                JsonObject fields = JsonParser.parseString(buffer.toString()).getAsJsonObject();

                JsonObject result = new JsonObject();
                result.addProperty(TYPE_FIELD, typeName);
                for (Map.Entry<String, JsonElement> entry : fields.entrySet()) {
                    if (!TYPE_FIELD.equals(entry.getKey())) {
                        result.add(entry.getKey(), entry.getValue());
                    }
                }
                gson.toJson(result, out);
            }

            @Override
            public T read(JsonReader in) throws IOException {
                JsonElement element = JsonParser.parseReader(in);
                if (element.isJsonNull()) {
                    return null;
                }
                if (!element.isJsonObject()) {
                    throw new JsonParseException("model config must be a JSON object, got " + element);
                }
                JsonObject object = element.getAsJsonObject().deepCopy();
                Class<? extends ModelConfig> target = targetClass(object.remove(TYPE_FIELD));

                TypeAdapter<? extends ModelConfig> delegate =
                    gson.getDelegateAdapter(ModelConfigTypeAdapterFactory.this, TypeToken.get(target));
                JsonReader lenientReader = new JsonReader(new StringReader(object.toString()));
                lenientReader.setLenient(true);
                return (T) delegate.read(lenientReader);
            }

            private Class<? extends ModelConfig> targetClass(JsonElement typeElement) {
                if (typeElement == null || typeElement.isJsonNull()) {
                    if (concrete) {
                        return requested.asSubclass(ModelConfig.class);
                    }
                    throw new JsonParseException("model config is missing the '" + TYPE_FIELD + "' field");
                }
                if (!typeElement.isJsonPrimitive()) {
                    throw new JsonParseException("'" + TYPE_FIELD + "' must be a string, got " + typeElement);
                }
                String typeName = typeElement.getAsString();
                Class<? extends ModelConfig> registered = typeToClass.get(typeName);
                if (registered == null) {
                    if (concrete) {
                        return requested.asSubclass(ModelConfig.class);
                    }
                    throw new JsonParseException(
                        "unknown model type '" + typeName + "', expected one of " + registeredTypes());
                }
                if (!requested.isAssignableFrom(registered)) {
                    throw new JsonParseException(
                        "model type '" + typeName + "' is a " + registered.getSimpleName()
                            + ", not a " + requested.getSimpleName());
                }
                return registered;
            }
        };
    }
}
