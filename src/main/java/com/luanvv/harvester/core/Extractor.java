package com.luanvv.harvester.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

/**
 * Turns an HTML document into loosely typed field maps, one per node matched by a
 * {@link Config.Shape}. A missing sub-node yields the field's zero value instead of dropping the
 * record: {@code ""} for text and attributes, {@code 0} for counts.
 */
@Slf4j
public class Extractor {
    private final String baseUrl;

    public Extractor(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public Document parse(String html) {
        return Jsoup.parse(html == null ? "" : html, baseUrl);
    }

    public List<Map<String, Object>> extract(String html, Config.Shape shape) {
        return extract(parse(html), shape);
    }

    public List<Map<String, Object>> extract(Document doc, Config.Shape shape) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (Element item : doc.select(shape.getItemSelector())) {
            Map<String, Object> record = new LinkedHashMap<>();
            for (Config.Field f : shape.getFields()) {
                record.put(f.getName(), extractField(item, f));
            }
            out.add(record);
        }
        log.debug("Extracted {} records with '{}'", out.size(), shape.getItemSelector());
        return out;
    }

    public Object extractField(Element item, Config.Field field) {
        String type = field.getType() == null ? "text" : field.getType();
        if ("count".equals(type)) {
            return field.getSelector() == null ? 0 : item.select(field.getSelector()).size();
        }
        Element target = field.getSelector() == null || field.getSelector().isBlank()
                ? item
                : item.selectFirst(field.getSelector());
        if (target == null) {
            return "";
        }
        return switch (type) {
            case "text" -> target.text().trim();
            case "attr" -> target.attr(field.getAttribute()).trim();
            case "url" -> target.hasAttr(field.getAttribute()) ? target.absUrl(field.getAttribute()) : "";
            default -> throw new IllegalArgumentException(
                    "Unknown field type '" + type + "' for field '" + field.getName() + "'");
        };
    }

    /** Text of the first node matching {@code selector}, whitespace-normalized. */
    public Optional<String> firstText(Document doc, String selector) {
        Elements found = doc.select(selector);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.first().text().trim());
    }

    /** Absolute URL held by {@code attribute} on the first node matching {@code selector}. */
    public Optional<String> firstUrl(Document doc, String selector, String attribute) {
        Element el = doc.selectFirst(selector);
        if (el == null || !el.hasAttr(attribute)) return Optional.empty();
        String abs = el.absUrl(attribute);
        return abs.isBlank() ? Optional.empty() : Optional.of(abs);
    }

    /** Raw content of the first matching node, for script data blocks. */
    public Optional<String> firstData(Document doc, String selector) {
        Element el = doc.selectFirst(selector);
        return el == null ? Optional.empty() : Optional.of(el.data());
    }
}
