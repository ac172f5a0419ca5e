package com.flamingo.ai.wikistructure.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for structuring one wiki page. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StructureRequest {

  @NotBlank(message = "Entity name is required")
  @Size(max = 255, message = "Entity name must not exceed 255 characters")
  private String name;

  /** Markdown rendering of the page; may be empty, which yields a record of defaults. */
  @NotNull(message = "Markdown content is required")
  private String markdown;
}
