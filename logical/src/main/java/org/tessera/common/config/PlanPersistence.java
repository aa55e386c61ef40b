/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.tessera.common.config;

import java.io.IOException;

import org.tessera.common.exceptions.UserException;
import org.tessera.common.logical.PlanNode;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser.Feature;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Reads and writes plans as JSON. Node types are identified by their {@code op} property.
 */
public class PlanPersistence {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(PlanPersistence.class);

  private final ObjectMapper mapper;

  public PlanPersistence() {
    this(new ObjectMapper());
  }

  public PlanPersistence(ObjectMapper mapper) {
    this.mapper = mapper;

    mapper.enable(SerializationFeature.INDENT_OUTPUT);
    mapper.configure(Feature.ALLOW_UNQUOTED_FIELD_NAMES, true);
    mapper.configure(JsonGenerator.Feature.QUOTE_FIELD_NAMES, true);
    mapper.configure(Feature.ALLOW_COMMENTS, true);
  }

  public ObjectMapper getMapper() {
    return mapper;
  }

  public String toJson(PlanNode plan) {
    try {
      return mapper.writeValueAsString(plan);
    } catch (JsonProcessingException e) {
      throw UserException.systemError(e)
          .message("Failure while serializing plan.")
          .addContext("plan", plan.display())
          .build(logger);
    }
  }

  /**
   * @throws UserException of type SYSTEM when the text is not a valid plan
   */
  public PlanNode fromJson(String json) {
    try {
      return mapper.readValue(json, PlanNode.class);
    } catch (IOException e) {
      throw UserException.systemError(e)
          .message("Failure while parsing plan.")
          .build(logger);
    }
  }
}
