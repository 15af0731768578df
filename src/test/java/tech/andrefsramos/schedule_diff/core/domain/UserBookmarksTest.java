package tech.andrefsramos.schedule_diff.core.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("UserBookmarks")
class UserBookmarksTest {

    @Test
    @DisplayName("normaliza repetições e nulos mantendo a ordem")
    void normalizes() {
        UserBookmarks b = UserBookmarks.of(Arrays.asList("s2", "s1", null, "s2"));

        assertThat(b.ids()).containsExactly("s2", "s1");
        assertThat(b.contains("s1")).isTrue();
        assertThat(b.contains("s3")).isFalse();
    }

    @Test
    void addAppendsOnlyNewIds() {
        UserBookmarks b = UserBookmarks.of(List.of("a")).add("b", "a", "c");

        assertThat(b.ids()).containsExactly("a", "b", "c");
    }

    @Test
    void removeUsesExactMatch() {
        UserBookmarks b = UserBookmarks.of(List.of("abc", "def", "ghi")).remove("ab", "def");

        assertThat(b.ids()).containsExactly("abc", "ghi");
    }

    @Test
    void nullListIsEmpty() {
        assertThat(UserBookmarks.of(null).isEmpty()).isTrue();
    }
}
