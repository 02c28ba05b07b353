package com.isolend.irm;

import com.isolend.core.journal.JournaledMap;
import com.isolend.core.journal.StateJournal;
import com.isolend.exception.ProtocolStateException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Named rate models a market may reference. Markets store the key, not the model, so a
 * two-step update can swap one key for another.
 */
@Component
public class RateModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(RateModelRegistry.class);

    private final JournaledMap<String, RateModel> models;

    public RateModelRegistry(StateJournal stateJournal) {
        this.models = stateJournal.newMap();
    }

    /** Binds {@code key}; access control is the caller's job (protocol owner only). */
    public void register(String key, RateModel model) {
        models.put(key, model);
        log.info("Registered rate model {} -> {}", key, model.getClass().getSimpleName());
    }

    public boolean contains(String key) {
        return models.containsKey(key);
    }

    public RateModel get(String key) {
        RateModel model = models.get(key);
        if (model == null) {
            throw new ProtocolStateException(
                    ProtocolStateException.Reason.UNKNOWN_RATE_MODEL,
                    "No rate model registered under " + key,
                    Map.of("rateModelKey", key));
        }
        return model;
    }
}
