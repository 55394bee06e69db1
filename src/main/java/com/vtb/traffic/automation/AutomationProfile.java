package com.vtb.traffic.automation;

import com.vtb.traffic.config.TrafficConfig;
import com.vtb.traffic.errors.ValidationException;
import lombok.Builder;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Описание удаленного действия: целевой хост, шаблон URL и поля тела запроса.
 * Платформенно-специфичные значения приходят только из конфигурации.
 */
@Getter
@Builder
public class AutomationProfile {

    public static final String RESOURCE_ID_PLACEHOLDER = "{resourceId}";

    private final String targetHost;
    /** Первая группа выражения - идентификатор ресурса */
    private final Pattern actionPathPattern;
    private final String actionUrlTemplate;
    private final String actionMethod;
    private final String scopeField;
    private final String partField;
    private final String completeField;
    private final String completionEvent;
    private final long delayMs;
    private final int scanLimit;
    private final boolean recordResults;
    @Builder.Default
    private final Map<String, String> extraHeaders = new LinkedHashMap<>();

    public static AutomationProfile from(TrafficConfig.Automation settings) {
        settings.ensureDefaults();
        Pattern pattern;
        try {
            pattern = Pattern.compile(settings.getActionPathPattern());
        } catch (PatternSyntaxException e) {
            throw new ValidationException("Некорректный actionPathPattern: " + e.getDescription());
        }
        if (pattern.matcher("").groupCount() < 1) {
            throw new ValidationException("actionPathPattern должен содержать группу с идентификатором ресурса");
        }
        if (!settings.getActionUrlTemplate().contains(RESOURCE_ID_PLACEHOLDER)) {
            throw new ValidationException("actionUrlTemplate должен содержать " + RESOURCE_ID_PLACEHOLDER);
        }
        return AutomationProfile.builder()
            .targetHost(settings.getTargetHost())
            .actionPathPattern(pattern)
            .actionUrlTemplate(settings.getActionUrlTemplate())
            .actionMethod(settings.getActionMethod())
            .scopeField(settings.getScopeField())
            .partField(settings.getPartField())
            .completeField(settings.getCompleteField())
            .completionEvent(settings.getCompletionEvent())
            .delayMs(settings.getDelayMs())
            .scanLimit(settings.getScanLimit())
            .recordResults(settings.isRecordResults())
            .extraHeaders(new LinkedHashMap<>(settings.getExtraHeaders()))
            .build();
    }

    /**
     * Идентификатор подставляется в URL как один сегмент пути: без разделителей,
     * управляющих символов и без "." / "..".
     */
    public static boolean isValidResourceId(String resourceId) {
        if (resourceId == null || resourceId.isEmpty() || ".".equals(resourceId) || "..".equals(resourceId)) {
            return false;
        }
        for (int i = 0; i < resourceId.length(); i++) {
            char c = resourceId.charAt(i);
            if (c == '/' || c == '\\' || c == '?' || c == '#' || Character.isWhitespace(c) || Character.isISOControl(c)) {
                return false;
            }
        }
        return true;
    }

    public String actionUrl(String resourceId) {
        if (!isValidResourceId(resourceId)) {
            throw new ValidationException("Недопустимый идентификатор ресурса: " + resourceId);
        }
        return actionUrlTemplate.replace(RESOURCE_ID_PLACEHOLDER, resourceId);
    }
}
