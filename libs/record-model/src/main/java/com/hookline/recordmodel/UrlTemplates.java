package com.hookline.recordmodel;

import java.util.Arrays;
import java.util.List;

/**
 * Expands the RFC 6570-flavoured URL templates GitHub embeds in payloads, e.g.
 * {@code https://api.github.com/users/octocat/following{/other_user}}.
 *
 * <p>Only the two forms GitHub actually sends are handled: {@code {name}} and the path-segment form
 * {@code {/name}}. Parameters are applied in order:
 *
 * <ul>
 *   <li>an absent parameter ({@code null} or {@code ""}) cuts the template at its {@code {/name}}
 *       token, or leaves it whole if there is none, and stops processing;
 *   <li>otherwise {@code {name}} is replaced by the value, or failing that {@code {/name}} is
 *       replaced by {@code /value}; a parameter matching neither is ignored.
 * </ul>
 *
 * <p>{@code 0} and {@code false} are real values and render via {@link String#valueOf(Object)}.
 * Braces left unmatched stay in the output.
 */
public final class UrlTemplates {

    private UrlTemplates() {
        // utility class
    }

    public static String interpolate(String template, UrlParam... params) {
        return interpolate(template, Arrays.asList(params));
    }

    public static String interpolate(String template, List<UrlParam> params) {
        if (template == null) {
            throw new IllegalArgumentException("template must not be null");
        }
        String result = template;
        for (UrlParam param : params) {
            String pathToken = "{/" + param.name() + "}";
            if (param.absent()) {
                int cut = result.indexOf(pathToken);
                if (cut >= 0) {
                    result = result.substring(0, cut);
                }
                break;
            }
            String value = String.valueOf(param.value());
            String plainToken = "{" + param.name() + "}";
            if (result.contains(plainToken)) {
                result = result.replace(plainToken, value);
            } else if (result.contains(pathToken)) {
                result = result.replace(pathToken, "/" + value);
            }
        }
        return result;
    }
}
