/*
 * Copyright 2026 Yellowbrick Data, Inc.
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
 */
package ai.floedb.nomatrix.service.error;

import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.ResourceBundle;
import org.jboss.logging.Logger;

/**
 * Renders failure messages from the {@code errors} resource bundle.
 *
 * <p>Lookup order: {@code KIND.messageKey}, then {@code KIND}, then a built-in template.
 * Placeholders are {@code {name}} and are replaced from the failure params.
 */
public final class MessageCatalog {
  private static final Logger LOG = Logger.getLogger(MessageCatalog.class);
  private static final String BUNDLE = "errors";

  private static volatile ResourceBundle bundle;

  private MessageCatalog() {}

  public static String render(ErrorKind kind, String messageKey, Map<String, String> params) {
    String base = kind.name();
    String key = messageKey != null && !messageKey.isBlank() ? base + "." + messageKey : base;

    ResourceBundle b = bundle();
    String template;
    if (b != null && b.containsKey(key)) {
      template = b.getString(key);
    } else if (b != null && b.containsKey(base)) {
      template = b.getString(base);
    } else {
      template = defaultTemplate(kind);
    }
    return format(template, params == null ? Map.of() : params);
  }

  private static ResourceBundle bundle() {
    var b = bundle;
    if (b == null) {
      try {
        b = ResourceBundle.getBundle(BUNDLE, Locale.ROOT);
        bundle = b;
      } catch (MissingResourceException e) {
        LOG.warnf("message bundle '%s' not found, using built-in templates", BUNDLE);
        return null;
      }
    }
    return b;
  }

  private static String defaultTemplate(ErrorKind code) {
    return switch (code) {
      case VALIDATION -> "Invalid value for {field}.";
      case CONFLICT -> "Conflict: {detail}.";
      case NOT_FOUND -> "The {resource} was not found: {id}.";
    };
  }

  private static String format(String template, Map<String, String> params) {
    String formattedMessage = template;
    for (var e : params.entrySet()) {
      formattedMessage =
          formattedMessage.replace("{" + e.getKey() + "}", String.valueOf(e.getValue()));
    }
    return formattedMessage;
  }
}
