package com.flamingo.ai.legaldoc.domain.repository;

import com.flamingo.ai.legaldoc.domain.entity.Document;
import com.flamingo.ai.legaldoc.domain.enums.DocumentStatus;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Document entities. */
@Repository
public interface DocumentRepository extends JpaRepository<Document, UUID> {

  /** Finds earlier submissions of the same content, newest first. */
  List<Document> findByFileHashOrderByUploadTimestampDesc(String fileHash);

  /** Counts documents by status. */
  long countByStatus(DocumentStatus status);
}
