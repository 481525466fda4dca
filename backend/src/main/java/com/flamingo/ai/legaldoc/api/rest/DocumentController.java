package com.flamingo.ai.legaldoc.api.rest;

import com.flamingo.ai.legaldoc.api.dto.response.DocumentResponse;
import com.flamingo.ai.legaldoc.domain.entity.Document;
import com.flamingo.ai.legaldoc.service.document.DocumentService;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for stored documents. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DocumentController {

  private final DocumentService documentService;

  /** Gets a stored document with its analysis, entities, clauses and risk assessment. */
  @GetMapping("/documents/{documentId}")
  public ResponseEntity<DocumentResponse> getDocument(@PathVariable UUID documentId) {
    Document document = documentService.getDocument(documentId);
    return ResponseEntity.ok(DocumentResponse.fromEntity(document));
  }
}
