package com.coursegen.orchestrator.model;

/**
 * Stable, 1-based lesson number within one course.
 *
 * {@link #COURSE} (0) tags artifacts that belong to the course as a whole
 * (curriculum, description, thumbnail, package) rather than to one lesson.
 */
public record LessonId(int number) implements Comparable<LessonId> {

    public static final LessonId COURSE = new LessonId(0);

    public LessonId {
        if (number < 0) {
            throw new IllegalArgumentException("Lesson number must not be negative: " + number);
        }
    }

    public static LessonId of(int number) {
        if (number < 1) {
            throw new IllegalArgumentException("Lesson numbers are 1-based: " + number);
        }
        return new LessonId(number);
    }

    public boolean isCourseLevel() {
        return number == 0;
    }

    /** Two-digit form used in file names, e.g. "03". */
    public String padded() {
        return "%02d".formatted(number);
    }

    @Override
    public int compareTo(LessonId other) {
        return Integer.compare(number, other.number);
    }

    @Override
    public String toString() {
        return isCourseLevel() ? "course" : "lesson-" + number;
    }
}
