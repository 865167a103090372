package com.example.sgkdocumentreader.service.pipeline;

import com.example.sgkdocumentreader.model.DocumentArtifact;
import com.example.sgkdocumentreader.model.DocumentProcessingResult;
import com.example.sgkdocumentreader.model.IdentityQuery;
import com.example.sgkdocumentreader.service.storage.StoredContent;

import java.util.List;

/**
 * Everything the persist step needs, kept on the run so a failed save can be
 * repeated without going through OCR again.
 *
 * @param queryPatientId patient that receives {@code identityQuery}, null when no candidate qualified
 */
record PendingCommit(DocumentArtifact draft,
                     List<StoredContent> contents,
                     DocumentProcessingResult result,
                     String queryPatientId,
                     IdentityQuery identityQuery) {

    PendingCommit {
        contents = List.copyOf(contents);
    }
}
