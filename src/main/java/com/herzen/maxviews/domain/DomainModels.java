package com.herzen.maxviews.domain;

public class DomainModels {
    public record CourseModule(String id, String courseId, String contextId, boolean visible, String availability) {}
}
