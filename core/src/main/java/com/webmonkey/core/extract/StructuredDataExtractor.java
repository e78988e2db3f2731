package com.webmonkey.core.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webmonkey.core.util.Jsons;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/** JSON-LD 블록(script[type=application/ld+json]) → Map/List. 깨진 블록은 건너뛴다. */
public class StructuredDataExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(StructuredDataExtractor.class);

    private final ObjectMapper om;

    public StructuredDataExtractor() {
        this(Jsons.mapper());
    }

    public StructuredDataExtractor(ObjectMapper om) {
        this.om = om;
    }

    public List<Object> extract(Document doc) {
        List<Object> out = new ArrayList<>();
        for (Element script : doc.select("script[type=application/ld+json]")) {
            String json = script.data().trim();
            if (json.isEmpty()) continue;
            try {
                Object v = om.readValue(json, Object.class);
                if (v != null) out.add(v);
            } catch (JsonProcessingException e) {
                LOG.debug("Skipping malformed JSON-LD block in {}: {}", doc.location(), e.getOriginalMessage());
            }
        }
        return out;
    }
}
