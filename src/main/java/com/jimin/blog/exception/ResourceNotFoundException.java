package com.jimin.blog.exception;

import java.util.UUID;

/**
 * ResourceNotFoundException - ID로 조회한 리소스가 없을 때 발생하는 예외
 *
 * 404로 변환되는 유일한 예외 (다른 예외 타입으로 404를 추론하지 않음)
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceName;
    private final UUID resourceId;

    /**
     * @param resourceName 리소스 이름 (예: "Post", "Comment")
     * @param resourceId   찾지 못한 ID
     */
    public ResourceNotFoundException(String resourceName, UUID resourceId) {
        super(notFoundMessage(resourceName, resourceId));
        this.resourceName = resourceName;
        this.resourceId = resourceId;
    }

    public static String notFoundMessage(String resourceName, UUID resourceId) {
        return resourceName + " with id: " + resourceId + " not found";
    }

    public String getResourceName() {
        return resourceName;
    }

    public UUID getResourceId() {
        return resourceId;
    }
}
