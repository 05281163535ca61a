package me.golemcore.pulse.domain.workflow;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Dotted-path lookup and {@code {path}} templating over a run context.
 *
 * <p>
 * {@code http_1.status} reads key {@code status} of the map stored under
 * {@code http_1}; numeric segments index into lists.
 */
public final class ContextPaths {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_.\\-]+)}");

    private ContextPaths() {
    }

    public static Object resolve(Map<String, Object> context, String path) {
        if (context == null || path == null || path.isBlank()) {
            return null;
        }
        if (context.containsKey(path)) {
            return context.get(path);
        }
        Object current = context;
        for (String segment : path.split("\\.")) {
            current = step(current, segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    public static boolean exists(Map<String, Object> context, String path) {
        return resolve(context, path) != null;
    }

    /**
     * Replace every {@code {path}} with the resolved value. Unknown paths are
     * left as written.
     */
    public static String render(String template, Map<String, Object> context) {
        if (template == null || template.isEmpty()) {
            return template;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder rendered = new StringBuilder();
        while (matcher.find()) {
            Object value = resolve(context, matcher.group(1));
            String replacement = value != null ? String.valueOf(value) : matcher.group(0);
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(rendered);
        return rendered.toString();
    }

    private static Object step(Object current, String segment) {
        if (current instanceof Map<?, ?> map) {
            return map.get(segment);
        }
        if (current instanceof List<?> list) {
            try {
                int index = Integer.parseInt(segment);
                return index >= 0 && index < list.size() ? list.get(index) : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
