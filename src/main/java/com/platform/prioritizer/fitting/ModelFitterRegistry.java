package com.platform.prioritizer.fitting;

import com.platform.prioritizer.error.GridException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Resolves {@code grid_config} class identifiers to the fitter that handles them.
 */
@Component
public class ModelFitterRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModelFitterRegistry.class);

    private final Map<String, ModelFitter> byClassId = new TreeMap<>();

    public ModelFitterRegistry(List<ModelFitter> fitters) {
        for (ModelFitter fitter : fitters) {
            for (String classId : fitter.classIdentifiers()) {
                ModelFitter previous = byClassId.put(classId, fitter);
                if (previous != null && previous != fitter) {
                    throw new IllegalStateException("Class identifier '" + classId + "' is claimed by both "
                            + previous.getClass().getSimpleName() + " and " + fitter.getClass().getSimpleName());
                }
            }
        }
        log.info("Registered model classes: {}", byClassId.keySet());
    }

    public ModelFitter resolve(String classId) {
        ModelFitter fitter = byClassId.get(classId);
        if (fitter == null) {
            throw new GridException("No model fitter for class '" + classId + "', known: " + byClassId.keySet());
        }
        return fitter;
    }

    public boolean supports(String classId) {
        return byClassId.containsKey(classId);
    }
}
