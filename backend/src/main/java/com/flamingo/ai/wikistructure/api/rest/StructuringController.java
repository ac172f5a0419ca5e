package com.flamingo.ai.wikistructure.api.rest;

import com.flamingo.ai.wikistructure.api.dto.request.StructureRequest;
import com.flamingo.ai.wikistructure.service.structure.EntityStructuringService;
import com.flamingo.ai.wikistructure.service.structure.model.BlockNode;
import com.flamingo.ai.wikistructure.service.structure.model.EntityKind;
import com.flamingo.ai.wikistructure.service.structure.model.EntityRecord;
import com.flamingo.ai.wikistructure.service.structure.parsing.BlockTreeParser;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller that structures a single posted wiki page. */
@RestController
@RequestMapping("/api/entities")
@RequiredArgsConstructor
public class StructuringController {

  private final BlockTreeParser blockTreeParser;
  private final EntityStructuringService entityStructuringService;

  /** Structures a Markdown page as the given entity kind ({@code game}, {@code school}, …). */
  @PostMapping("/{kind}/structure")
  public ResponseEntity<EntityRecord> structure(
      @PathVariable String kind, @Valid @RequestBody StructureRequest request) {
    EntityKind entityKind = EntityKind.fromName(kind);
    List<BlockNode> nodes = blockTreeParser.parse(request.getMarkdown());
    return ResponseEntity.ok(
        entityStructuringService.structure(entityKind, request.getName(), nodes));
  }
}
