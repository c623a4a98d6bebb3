// This file is part of AFExtract.
// Copyright (C) 2026  The AFExtract Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.afextract.utils;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * This class simply provides a static initialization and configuration of the
 * Jackson ObjectMapper for use throughout the engine. Since the mapper takes a
 * fair amount of construction and is thread safe, the Jackson docs recommend
 * initializing it once per app.
 * @since 1.0
 */
public final class JSON {
  
  /** Jackson de/serializer initialized, configured and shared */
  private static final ObjectMapper jsonMapper = new ObjectMapper();
  static {
    // NaN shows up for missing summary values.
    jsonMapper.configure(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS, true);
  }
  
  /**
   * Deserializes a JSON formatted string to a specific class type
   * @param json The string to deserialize
   * @param pojo The class type of the object used for deserialization
   * @return An object of the {@link pojo} type
   * @throws IllegalArgumentException if the data or class was null or parsing 
   * failed
   */
  public static final <T> T parseToObject(final String json,
                                          final Class<T> pojo) {
    if (json == null || json.isEmpty())
      throw new IllegalArgumentException("Incoming data was null or empty");
    if (pojo == null)
      throw new IllegalArgumentException("Missing class type");
    
    try {
      return jsonMapper.readValue(json, pojo);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(e);
    }
  }
  
  /** @return The shared mapper for streaming or tree access. */
  public static final ObjectMapper getMapper() {
    return jsonMapper;
  }
  
}
