package com.example.cameratrap.service.pipeline;

import com.example.cameratrap.domain.Species;
import com.example.cameratrap.repository.SpeciesRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Maps a classifier prediction to a catalog row. Unknown species get a stub holding only the
 * scientific name, committed on its own so concurrent workers converge on one row.
 */
@Service
public class SpeciesResolver {

    private static final Logger log = LoggerFactory.getLogger(SpeciesResolver.class);

    private final SpeciesRepository species;
    private final TransactionTemplate newTransaction;

    public SpeciesResolver(SpeciesRepository species, PlatformTransactionManager transactionManager) {
        this.species = species;
        this.newTransaction = new TransactionTemplate(transactionManager);
        this.newTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public Long resolve(String scientificName) {
        if (scientificName == null || scientificName.isBlank()) {
            throw new IllegalArgumentException("Scientific name is required");
        }
        String name = scientificName.trim();
        return species.findByScientificName(name)
                .map(Species::getId)
                .orElseGet(() -> createStub(name));
    }

    private Long createStub(String scientificName) {
        try {
            Long id = newTransaction.execute(status -> species.saveAndFlush(new Species(scientificName)).getId());
            log.info("Created species stub '{}' with id {}", scientificName, id);
            return id;
        } catch (DataIntegrityViolationException ex) {
            return species.findByScientificName(scientificName)
                    .map(Species::getId)
                    .orElseThrow(() -> ex);
        }
    }
}
