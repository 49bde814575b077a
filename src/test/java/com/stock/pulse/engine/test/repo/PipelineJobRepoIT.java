package com.stock.pulse.engine.test.repo;

import com.stock.pulse.engine.model.documents.ExtractionJobDocument;
import com.stock.pulse.engine.repo.documents.PipelineJobRepo;
import com.stock.pulse.engine.test.BaseContainers;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataMongoTest
@ActiveProfiles("test")
class PipelineJobRepoIT extends BaseContainers {

    @Autowired
    PipelineJobRepo jobRepo;

    @Test
    void newestJobsComeFirst() {
        jobRepo.deleteAll();
        Instant now = Instant.now();
        for (int i = 0; i < 3; i++) {
            jobRepo.save(ExtractionJobDocument.builder()
                    .jobId("job-" + i)
                    .extractionType("quotes")
                    .status("success")
                    .symbols(List.of("TCS"))
                    .createdAt(now.minusSeconds(60L * (3 - i)))
                    .successCount(1)
                    .build());
        }

        List<ExtractionJobDocument> out = jobRepo.findByOrderByCreatedAtDesc(PageRequest.of(0, 2));

        assertThat(out).extracting(ExtractionJobDocument::getJobId).containsExactly("job-2", "job-1");
    }
}
