package com.nori.tc.deeplink.control;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * deep link 파라미터(contentId, mediaType).
 *
 * - 값이 없는 항목은 쿼리에서 빠진다.
 * - {@link #NONE}: 컨텐츠 없이 앱만 띄우는 plain launch
 */
public record DeepLinkParams(String contentId, String mediaType) {

    public static final DeepLinkParams NONE = new DeepLinkParams(null, null);

    /** 영상 재생 beacon(VOD 또는 Live)이 필요한 mediaType */
    private static final Set<String> VIDEO_MEDIA_TYPES = Set.of("movie", "episode");

    public boolean isEmpty() {
        return isBlank(contentId) && isBlank(mediaType);
    }

    public boolean requiresVideo() {
        return mediaType != null && VIDEO_MEDIA_TYPES.contains(mediaType.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * 쿼리 파라미터 맵(삽입 순서: contentId, mediaType).
     */
    public Map<String, String> toQueryParams() {
        Map<String, String> out = new LinkedHashMap<>();
        if (!isBlank(contentId)) {
            out.put("contentId", contentId);
        }
        if (!isBlank(mediaType)) {
            out.put("mediaType", mediaType);
        }
        return out;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
