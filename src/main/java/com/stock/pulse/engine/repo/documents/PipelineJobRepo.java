package com.stock.pulse.engine.repo.documents;

import com.stock.pulse.engine.model.documents.ExtractionJobDocument;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PipelineJobRepo extends MongoRepository<ExtractionJobDocument, String> {

    List<ExtractionJobDocument> findByOrderByCreatedAtDesc(Pageable page);
}
