package com.quantori.nqp.storage.postgres;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.experimental.UtilityClass;

@UtilityClass
class JsonMapper {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  /**
   * Decodes a json or jsonb value into maps, lists and scalars.
   */
  static Object fromJson(String json) throws JsonProcessingException {
    return json == null ? null : OBJECT_MAPPER.readValue(json, Object.class);
  }
}
