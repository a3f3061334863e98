/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.services;

import java.util.Optional;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatheralerts.api.types.AlertFormType;
import villagecompute.weatheralerts.config.AggregationConfig;
import villagecompute.weatheralerts.data.store.HierarchicalStore;
import villagecompute.weatheralerts.data.store.StorePaths;

/**
 * Reads and writes raw alert forms under {@code <formsRoot>/<uid>/<formId>}.
 *
 * <p>
 * Forms are stored exactly as submitted; aggregation reads them back by id.
 */
@ApplicationScoped
public class AlertFormService {

    private static final Logger LOG = Logger.getLogger(AlertFormService.class);

    private final HierarchicalStore store;
    private final ObjectMapper objectMapper;
    private final AggregationConfig config;

    @Inject
    public AlertFormService(HierarchicalStore store, ObjectMapper objectMapper, AggregationConfig config) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.config = config;
    }

    /**
     * Writes a form, replacing any previous form with the same id.
     *
     * @throws villagecompute.weatheralerts.exceptions.ValidationException
     *             if {@code uid} or {@code formId} is not a valid path segment
     */
    public void store(String uid, String formId, AlertFormType form) {
        String path = formPath(uid, formId);
        store.set(path, objectMapper.valueToTree(form));
        LOG.debugf("Stored alert form %s for user %s", formId, uid);
    }

    /**
     * Reads a stored form.
     *
     * @return the form, or empty if none is stored at that id
     */
    public Optional<AlertFormType> find(String uid, String formId) {
        return store.get(formPath(uid, formId)).map(node -> objectMapper.convertValue(node, AlertFormType.class));
    }

    private String formPath(String uid, String formId) {
        return StorePaths.join(config.formsRoot(), uid, formId);
    }
}
