package com.study.webflux.vitals.domain.history.model;

public record ProjectId(
	String value
) {
	public static final ProjectId DEFAULT = new ProjectId("default");

	public ProjectId {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("projectId cannot be null or blank");
		}
		if (value.length() > 128) {
			throw new IllegalArgumentException("projectId too long");
		}
	}

	public static ProjectId of(String value) {
		return new ProjectId(value);
	}

	public static ProjectId defaultProject() {
		return DEFAULT;
	}

	public static ProjectId ofNullable(String value) {
		return (value == null || value.isBlank()) ? DEFAULT : new ProjectId(value);
	}
}
