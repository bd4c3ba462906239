package com.quantori.pse.storage.file;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.quantori.pse.storage.file.model.PlasmidDocument;
import lombok.experimental.UtilityClass;

@UtilityClass
class JsonMapper {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
      .enable(SerializationFeature.INDENT_OUTPUT);

  static String toJsonString(PlasmidDocument document) throws JsonProcessingException {
    return OBJECT_MAPPER.writeValueAsString(document);
  }

  static PlasmidDocument toPlasmidDocument(String json) throws JsonProcessingException {
    return OBJECT_MAPPER.readValue(json, PlasmidDocument.class);
  }
}
