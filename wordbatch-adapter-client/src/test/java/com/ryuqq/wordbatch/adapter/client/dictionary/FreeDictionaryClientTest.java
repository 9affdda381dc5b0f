package com.ryuqq.wordbatch.adapter.client.dictionary;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.wordbatch.core.exception.DictionaryLookupException;
import com.ryuqq.wordbatch.core.exception.WordNotFoundException;
import com.ryuqq.wordbatch.core.model.DictionaryEntry;
import com.ryuqq.wordbatch.core.time.Sleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * FreeDictionaryClient 유닛 테스트.
 *
 * <ul>
 *   <li>200: 발음/품사 파싱</li>
 *   <li>404: 재시도 없이 WordNotFoundException</li>
 *   <li>5xx, 타임아웃: backoff 재시도 후 성공 또는 소진</li>
 * </ul>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class FreeDictionaryClientTest {

    private static final String SERENE = """
        [
          {
            "word": "serene",
            "phonetics": [ { "audio": "" }, { "text": "/səˈriːn/" } ],
            "meanings": [
              { "partOfSpeech": "adjective" },
              { "partOfSpeech": "noun" },
              { "partOfSpeech": "adjective" }
            ]
          }
        ]
        """;

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> ok;

    @Mock
    private HttpResponse<String> serverError;

    @Mock
    private Sleeper sleeper;

    private FreeDictionaryClient client;

    @BeforeEach
    void setUp() {
        client = new FreeDictionaryClient(httpClient, new ObjectMapper(), new DictionaryClientConfig(), sleeper);
    }

    @Test
    void lookup_성공() throws Exception {
        // given
        when(ok.statusCode()).thenReturn(200);
        when(ok.body()).thenReturn(SERENE);
        doReturn(ok).when(httpClient).send(any(), any());

        // when
        DictionaryEntry entry = client.lookup("serene");

        // then
        assertThat(entry.phonetic()).isEqualTo("/səˈriːn/");
        assertThat(entry.partsOfSpeech()).containsExactly("adjective", "noun");

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        assertThat(captor.getValue().uri().toString())
            .isEqualTo("https://api.dictionaryapi.dev/api/v2/entries/en/serene");
        assertThat(captor.getValue().timeout()).contains(Duration.ofSeconds(10));
        verifyNoInteractions(sleeper);
    }

    @Test
    void lookup_404는_재시도_없이_WordNotFound() throws Exception {
        // given
        when(ok.statusCode()).thenReturn(404);
        doReturn(ok).when(httpClient).send(any(), any());

        // when & then
        assertThatThrownBy(() -> client.lookup("qwzx"))
            .isInstanceOf(WordNotFoundException.class)
            .hasMessageContaining("qwzx");
        verify(httpClient, times(1)).send(any(), any());
    }

    @Test
    void lookup_5xx_후_성공하면_결과_반환() throws Exception {
        // given
        when(serverError.statusCode()).thenReturn(503);
        when(ok.statusCode()).thenReturn(200);
        when(ok.body()).thenReturn(SERENE);
        doReturn(serverError).doReturn(serverError).doReturn(ok).when(httpClient).send(any(), any());

        // when
        DictionaryEntry entry = client.lookup("serene");

        // then
        assertThat(entry.partsOfSpeech()).isNotEmpty();
        verify(sleeper).sleep(Duration.ofSeconds(1));
        verify(sleeper).sleep(Duration.ofSeconds(2));
    }

    @Test
    void lookup_타임아웃이_계속되면_5회_후_DictionaryLookupException() throws Exception {
        // given
        doThrow(new HttpTimeoutException("timed out")).when(httpClient).send(any(), any());

        // when & then
        assertThatThrownBy(() -> client.lookup("serene"))
            .isInstanceOf(DictionaryLookupException.class)
            .isNotInstanceOf(WordNotFoundException.class)
            .hasMessageContaining("5 attempts");
        verify(httpClient, times(5)).send(any(), any());
        verify(sleeper, times(4)).sleep(any());
    }

    @Test
    void lookup_연결_오류는_즉시_DictionaryLookupException() throws Exception {
        doThrow(new ConnectException("refused")).when(httpClient).send(any(), any());

        assertThatThrownBy(() -> client.lookup("serene"))
            .isInstanceOf(DictionaryLookupException.class)
            .hasCauseInstanceOf(ConnectException.class);
        verifyNoInteractions(sleeper);
    }

    @Test
    void lookup_배열이_아닌_응답은_DictionaryLookupException() throws Exception {
        when(ok.statusCode()).thenReturn(200);
        when(ok.body()).thenReturn("{\"title\": \"No Definitions Found\"}");
        doReturn(ok).when(httpClient).send(any(), any());

        assertThatThrownBy(() -> client.lookup("serene"))
            .isInstanceOf(DictionaryLookupException.class)
            .hasMessageContaining("Unexpected response format");
    }

    @Test
    void uriFor_공백은_인코딩() {
        assertThat(client.uriFor("ice cream").toString()).endsWith("/ice%20cream");
        assertThat(new DictionaryClientConfig().withBaseUrl("http://localhost/api/").baseUrl())
            .isEqualTo("http://localhost/api");
    }
}
