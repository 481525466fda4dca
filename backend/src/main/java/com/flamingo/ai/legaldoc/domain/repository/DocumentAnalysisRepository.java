package com.flamingo.ai.legaldoc.domain.repository;

import com.flamingo.ai.legaldoc.domain.entity.DocumentAnalysis;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for DocumentAnalysis entities. */
@Repository
public interface DocumentAnalysisRepository extends JpaRepository<DocumentAnalysis, UUID> {

  Optional<DocumentAnalysis> findByDocumentId(UUID documentId);
}
