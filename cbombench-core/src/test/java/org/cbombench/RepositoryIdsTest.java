package org.cbombench;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RepositoryIds Tests")
class RepositoryIdsTest {

	@ParameterizedTest
	@DisplayName("Should derive repository ids from clone URLs")
	@CsvSource({ "https://github.com/acme/widgets, acme/widgets", "https://github.com/acme/widgets.git, acme/widgets",
			"https://github.com/acme/widgets/, acme/widgets", "https://www.github.com/acme/widgets, acme/widgets",
			"git@github.com:acme/widgets.git, acme/widgets", "https://github.com/acme/widgets/tree/main, acme/widgets",
			"https://gitlab.com/group/sub/project.git, gitlab.com/group/sub/project" })
	void shouldDeriveIds(String url, String expected) {
		assertThat(RepositoryIds.fromUrl(url)).isEqualTo(expected);
		assertThat(RepositoryIds.isValid(url)).isTrue();
	}

	@ParameterizedTest
	@DisplayName("Should reject URLs without a repository")
	@ValueSource(strings = { "", "   ", "https://github.com/acme", "git@github.com:acme", "not a url",
			"https://gitlab.com/" })
	void shouldRejectInvalidUrls(String url) {
		assertThatThrownBy(() -> RepositoryIds.fromUrl(url)).isInstanceOf(InvalidRepositoryException.class);
		assertThat(RepositoryIds.isValid(url)).isFalse();
	}

	@Test
	@DisplayName("Should keep the offending URL on the exception")
	void shouldExposeUrl() {
		assertThatThrownBy(() -> RepositoryIds.fromUrl("https://github.com/acme"))
			.isInstanceOfSatisfying(InvalidRepositoryException.class,
					e -> assertThat(e.getUrl()).isEqualTo("https://github.com/acme"));
	}

	@Test
	@DisplayName("Should turn repository ids into file-system friendly segments")
	void shouldCreatePathSegments() {
		assertThat(RepositoryIds.toPathSegment("acme/widgets")).isEqualTo("acme__widgets");
		assertThat(RepositoryIds.toPathSegment("gitlab.com/group/project")).isEqualTo("gitlab.com__group__project");
		assertThat(RepositoryIds.toPathSegment("odd name:1")).isEqualTo("odd_name_1");
	}

}
