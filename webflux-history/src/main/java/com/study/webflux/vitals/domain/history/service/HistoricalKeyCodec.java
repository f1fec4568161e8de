package com.study.webflux.vitals.domain.history.service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.IsoFields;
import java.util.Arrays;
import java.util.Optional;

import com.study.webflux.vitals.domain.history.model.AggregationGranularity;
import com.study.webflux.vitals.domain.history.model.PointKey;
import com.study.webflux.vitals.domain.history.model.ProjectId;
import com.study.webflux.vitals.domain.history.model.RenderingStrategy;

/**
 * 이력 데이터 저장 키와 조회 패턴을 생성하고 해석합니다.
 *
 * <p>
 * 키 형식: {@code historical:{projectId}:{strategy}:{yyyy-MM-dd}:{epochMillis}}. 날짜는 항상 UTC 기준입니다. 이전 버전이 기록한
 * 일 단위 키({@code historical:{projectId}:{strategy}:{yyyy-MM-dd}})도 해석할 수 있습니다.
 */
public final class HistoricalKeyCodec {

	public static final String HISTORICAL_PREFIX = "historical";
	public static final String AGGREGATE_SEGMENT = "agg";

	private static final String SEPARATOR = ":";
	private static final String WILDCARD = "*";
	private static final String GLOB_METACHARACTERS = "*?[]\\";

	private HistoricalKeyCodec() {
	}

	/** 정확한 측정 시각(밀리초)까지 포함한 데이터 포인트 키를 생성합니다. */
	public static String pointKey(RenderingStrategy strategy, ProjectId projectId, Instant timestamp) {
		return dayPrefix(strategy, projectId, timestamp) + SEPARATOR + timestamp.toEpochMilli();
	}

	/** 하루에 하나의 스냅샷만 두던 이전 형식의 키를 생성합니다. */
	public static String legacyPointKey(RenderingStrategy strategy,
		ProjectId projectId,
		Instant timestamp) {
		return dayPrefix(strategy, projectId, timestamp);
	}

	/** 전략/프로젝트 조합의 모든 데이터 포인트를 찾는 패턴입니다. */
	public static String pointPattern(RenderingStrategy strategy, ProjectId projectId) {
		return String.join(SEPARATOR,
			HISTORICAL_PREFIX,
			escapeGlob(projectId.value()),
			strategy.keySegment(),
			WILDCARD);
	}

	/** 특정 UTC 날짜의 데이터 포인트(이전 형식 키 포함)를 찾는 패턴입니다. */
	public static String dayPattern(RenderingStrategy strategy, ProjectId projectId, Instant date) {
		return String.join(SEPARATOR,
			HISTORICAL_PREFIX,
			escapeGlob(projectId.value()),
			strategy.keySegment(),
			formatDay(date)) + WILDCARD;
	}

	/** 집계 결과 보관용 키를 생성합니다. */
	public static String aggregateKey(RenderingStrategy strategy,
		ProjectId projectId,
		AggregationGranularity granularity,
		Instant timestamp) {
		return String.join(SEPARATOR,
			HISTORICAL_PREFIX,
			AGGREGATE_SEGMENT,
			projectId.value(),
			strategy.keySegment(),
			granularity.keySegment(),
			bucketLabel(granularity, timestamp));
	}

	/**
	 * 데이터 포인트 키를 해석합니다. projectId에 구분자가 포함될 수 있으므로 뒤에서부터 해석합니다.
	 *
	 * @return 데이터 포인트 키가 아니면 빈 Optional
	 */
	public static Optional<PointKey> parsePointKey(String key) {
		String prefix = HISTORICAL_PREFIX + SEPARATOR;
		if (key == null || !key.startsWith(prefix)) {
			return Optional.empty();
		}
		String[] parts = key.substring(prefix.length()).split(SEPARATOR, -1);
		int last = parts.length - 1;

		if (parts.length >= 4 && isEpochMillis(parts[last])) {
			return parseSegments(parts, last - 1, Optional.of(Long.parseLong(parts[last])));
		}
		if (parts.length >= 3) {
			return parseSegments(parts, last, Optional.empty());
		}
		return Optional.empty();
	}

	static String formatDay(Instant timestamp) {
		return DateTimeFormatter.ISO_LOCAL_DATE.format(LocalDate.ofInstant(timestamp, ZoneOffset.UTC));
	}

	static String escapeGlob(String value) {
		StringBuilder escaped = new StringBuilder(value.length());
		for (char c : value.toCharArray()) {
			if (GLOB_METACHARACTERS.indexOf(c) >= 0) {
				escaped.append('\\');
			}
			escaped.append(c);
		}
		return escaped.toString();
	}

	private static String dayPrefix(RenderingStrategy strategy, ProjectId projectId, Instant timestamp) {
		return String.join(SEPARATOR,
			HISTORICAL_PREFIX,
			projectId.value(),
			strategy.keySegment(),
			formatDay(timestamp));
	}

	private static String bucketLabel(AggregationGranularity granularity, Instant timestamp) {
		ZonedDateTime utc = timestamp.atZone(ZoneOffset.UTC);
		return switch (granularity) {
			case HOUR -> String.format("%04d-%02d-%02d-%02d",
				utc.getYear(),
				utc.getMonthValue(),
				utc.getDayOfMonth(),
				utc.getHour());
			case DAY -> String.format("%04d-%02d-%02d",
				utc.getYear(),
				utc.getMonthValue(),
				utc.getDayOfMonth());
			case WEEK -> String.format("%04d-W%02d",
				utc.get(IsoFields.WEEK_BASED_YEAR),
				utc.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
			case MONTH -> String.format("%04d-%02d", utc.getYear(), utc.getMonthValue());
		};
	}

	private static Optional<PointKey> parseSegments(String[] parts,
		int dayIndex,
		Optional<Long> epochMillis) {
		int strategyIndex = dayIndex - 1;
		if (strategyIndex < 1) {
			return Optional.empty();
		}
		Optional<LocalDate> day = parseDay(parts[dayIndex]);
		Optional<RenderingStrategy> strategy = parseStrategy(parts[strategyIndex]);
		if (day.isEmpty() || strategy.isEmpty()) {
			return Optional.empty();
		}
		String projectId = String.join(SEPARATOR, Arrays.copyOfRange(parts, 0, strategyIndex));
		if (projectId.isBlank()) {
			return Optional.empty();
		}
		return Optional.of(new PointKey(ProjectId.of(projectId), strategy.get(), day.get(), epochMillis));
	}

	private static Optional<LocalDate> parseDay(String segment) {
		try {
			return Optional.of(LocalDate.parse(segment, DateTimeFormatter.ISO_LOCAL_DATE));
		} catch (DateTimeParseException e) {
			return Optional.empty();
		}
	}

	private static Optional<RenderingStrategy> parseStrategy(String segment) {
		for (RenderingStrategy strategy : RenderingStrategy.values()) {
			if (strategy.keySegment().equals(segment)) {
				return Optional.of(strategy);
			}
		}
		return Optional.empty();
	}

	/** 1970년 이전 시각은 음수 epoch 밀리초로 기록되므로 선행 '-'를 허용합니다. */
	private static boolean isEpochMillis(String segment) {
		String digits = segment.startsWith("-") ? segment.substring(1) : segment;
		if (digits.isEmpty() || digits.length() > 18) {
			return false;
		}
		for (char c : digits.toCharArray()) {
			if (!Character.isDigit(c)) {
				return false;
			}
		}
		return true;
	}
}
