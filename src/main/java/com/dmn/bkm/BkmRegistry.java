package com.dmn.bkm;

import com.dmn.exception.BkmInvocationException;
import com.dmn.model.BusinessKnowledgeModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named collection of BKMs. Safe for concurrent use; {@link #snapshot()} gives the immutable
 * view handed to an evaluation.
 */
public class BkmRegistry {

    private static final Logger log = LoggerFactory.getLogger(BkmRegistry.class);

    private final Map<String, BusinessKnowledgeModel> bkms = new ConcurrentHashMap<>();

    public void add(BusinessKnowledgeModel bkm) {
        if (bkm == null || bkm.name() == null || bkm.name().isBlank()) {
            throw new BkmInvocationException("BKM name must not be empty");
        }
        if (bkms.put(bkm.name(), bkm) != null) {
            log.info("Replaced BKM '{}'", bkm.name());
        }
    }

    public boolean has(String name) {
        return bkms.containsKey(name);
    }

    public Optional<BusinessKnowledgeModel> get(String name) {
        return Optional.ofNullable(bkms.get(name));
    }

    public List<String> names() {
        return bkms.keySet().stream().sorted().toList();
    }

    public boolean remove(String name) {
        return bkms.remove(name) != null;
    }

    public void clear() {
        bkms.clear();
    }

    public int size() {
        return bkms.size();
    }

    public Map<String, BusinessKnowledgeModel> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(bkms));
    }
}
