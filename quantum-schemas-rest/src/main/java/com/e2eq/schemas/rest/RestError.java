package com.e2eq.schemas.rest;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.List;

@Data
@EqualsAndHashCode
@SuperBuilder
@NoArgsConstructor
@RegisterForReflection
public class RestError {
   protected int status;
   protected String statusMessage;
   protected String reasonMessage;
   protected String category;
   protected List<String> chain;
}
