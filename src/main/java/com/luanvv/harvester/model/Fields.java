package com.luanvv.harvester.model;

import java.util.Map;

/** Defaulting rules for extractor field maps. */
final class Fields {
    private Fields() {}

    static String string(Map<String, Object> fields, String name) {
        Object v = fields.get(name);
        return v == null ? "" : v.toString().trim();
    }

    static int integer(Map<String, Object> fields, String name) {
        Object v = fields.get(name);
        if (v instanceof Number n) return n.intValue();
        if (v == null) return 0;
        try {
            return Integer.parseInt(v.toString().trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
