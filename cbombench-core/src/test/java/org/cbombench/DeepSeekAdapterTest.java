package org.cbombench;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("DeepSeekAdapter Tests")
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DeepSeekAdapterTest {

	@Mock
	private HttpClient mockHttpClient;

	@Mock
	private HttpResponse<String> mockResponse;

	private ObjectMapper objectMapper;

	private DeepSeekAdapter adapter;

	@BeforeEach
	void setUp() {
		objectMapper = ObjectMapperFactory.create();
		BenchmarkProperties properties = new BenchmarkProperties();
		properties.setDeepseekBaseUrl("https://llm.example.test/");
		adapter = new DeepSeekAdapter(mockHttpClient, objectMapper, properties, "secret-key");
	}

	private String chatResponse(String content) throws Exception {
		JsonNode envelope = objectMapper.createObjectNode()
			.set("choices", objectMapper.createArrayNode()
				.add(objectMapper.createObjectNode()
					.set("message", objectMapper.createObjectNode().put("role", "assistant").put("content", content))));
		return objectMapper.writeValueAsString(envelope);
	}

	private void givenResponse(int status, String body) throws Exception {
		when(mockResponse.statusCode()).thenReturn(status);
		when(mockResponse.body()).thenReturn(body);
		doReturn(mockResponse).when(mockHttpClient).send(any(HttpRequest.class), any());
	}

	@Nested
	@DisplayName("Answer Handling")
	class AnswerHandlingTest {

		@Test
		@DisplayName("Should strip Markdown code fences")
		void shouldStripCodeFence() {
			assertThat(DeepSeekAdapter.stripCodeFence("```json\n{\"a\":1}\n```")).isEqualTo("{\"a\":1}");
			assertThat(DeepSeekAdapter.stripCodeFence("Here you go:\n```\n[1]\n```\nEnjoy")).isEqualTo("[1]");
			assertThat(DeepSeekAdapter.stripCodeFence("```json\n{\"a\":1}")).isEqualTo("{\"a\":1}");
			assertThat(DeepSeekAdapter.stripCodeFence("  {\"a\":1}  ")).isEqualTo("{\"a\":1}");
		}

		@Test
		@DisplayName("Should wrap a bare component array into a CycloneDX document")
		void shouldWrapComponentArray() throws Exception {
			JsonNode document = objectMapper.readTree(adapter.completeDocument("[{\"name\":\"AES-128\"}]"));

			assertThat(document.path("bomFormat").asText()).isEqualTo("CycloneDX");
			assertThat(document.path("specVersion").asText()).isEqualTo("1.6");
			assertThat(document.path("components").path(0).path("name").asText()).isEqualTo("AES-128");
		}

		@Test
		@DisplayName("Should keep existing header fields")
		void shouldKeepExistingHeader() throws Exception {
			JsonNode document = objectMapper
				.readTree(adapter.completeDocument("{\"bomFormat\":\"CycloneDX\",\"specVersion\":\"1.4\"}"));

			assertThat(document.path("specVersion").asText()).isEqualTo("1.4");
		}

		@Test
		@DisplayName("Should return unparsable answers unchanged")
		void shouldPassThroughInvalidJson() {
			assertThat(adapter.completeDocument("I could not find anything")).isEqualTo("I could not find anything");
			assertThat(adapter.completeDocument("42")).isEqualTo("42");
		}

		@Test
		@DisplayName("Should fail when the response carries no message content")
		void shouldFailWithoutContent() {
			assertThatThrownBy(() -> adapter.extractContent("{\"choices\":[]}"))
				.isInstanceOfSatisfying(CbomAdapterException.class,
						e -> assertThat(e.getKind()).isEqualTo(CbomAdapterException.Kind.UNPARSABLE_OUTPUT));
			assertThatThrownBy(() -> adapter.extractContent("<html>")).isInstanceOf(CbomAdapterException.class);
		}

	}

	@Test
	@DisplayName("Should name the repository and branch in the request")
	void shouldBuildRequestBody() throws Exception {
		JsonNode body = objectMapper.readTree(adapter.requestBody("https://github.com/acme/widgets", "main"));

		assertThat(body.path("model").asText()).isEqualTo("deepseek-chat");
		assertThat(body.path("stream").asBoolean(true)).isFalse();
		assertThat(body.path("messages").path(0).path("role").asText()).isEqualTo("system");
		assertThat(body.path("messages").path(1).path("content").asText())
			.contains("Project: https://github.com/acme/widgets")
			.contains("Branch: main");
	}

	@Test
	@DisplayName("Should post to the chat completions endpoint and return the completed document")
	void shouldGenerateDocument() throws Exception {
		givenResponse(200, chatResponse("```json\n{\"components\":[]}\n```"));

		GeneratedCbom generated = adapter.generate("https://github.com/acme/widgets", "main");

		assertThat(objectMapper.readTree(generated.document()).path("bomFormat").asText()).isEqualTo("CycloneDX");
		ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
		verify(mockHttpClient).send(request.capture(), any());
		assertThat(request.getValue().uri().toString()).isEqualTo("https://llm.example.test/chat/completions");
		assertThat(request.getValue().headers().firstValue("Authorization")).contains("Bearer secret-key");
	}

	@Test
	@DisplayName("Should report HTTP errors as tool errors")
	void shouldFailOnHttpError() throws Exception {
		givenResponse(401, "{\"error\":\"invalid key\"}");

		assertThatThrownBy(() -> adapter.generate("https://github.com/acme/widgets", "main"))
			.isInstanceOfSatisfying(CbomAdapterException.class,
					e -> assertThat(e.getKind()).isEqualTo(CbomAdapterException.Kind.TOOL_ERROR))
			.hasMessageContaining("401");
	}

	@Test
	@DisplayName("Should report request timeouts as timeouts")
	void shouldReportTimeout() throws Exception {
		doThrow(new HttpTimeoutException("request timed out")).when(mockHttpClient).send(any(HttpRequest.class), any());

		assertThatThrownBy(() -> adapter.generate("https://github.com/acme/widgets", "main"))
			.isInstanceOfSatisfying(CbomAdapterException.class,
					e -> assertThat(e.getKind()).isEqualTo(CbomAdapterException.Kind.TIMEOUT));
	}

}
