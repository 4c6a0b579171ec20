package com.yescount.planner.application;

import com.yescount.planner.domain.model.Event;
import com.yescount.planner.domain.model.EventQuery;
import com.yescount.planner.domain.model.EventSource;
import com.yescount.planner.domain.model.VectorFilter;
import com.yescount.planner.domain.port.out.EmbeddingClient;
import com.yescount.planner.domain.port.out.EventRepository;
import com.yescount.planner.domain.port.out.VectorCollection;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EventSearchTest {

    @Mock
    private EventRepository eventRepository;

    @Mock
    private EmbeddingClient embeddingClient;

    @Mock
    private VectorCollection vectorCollection;

    @Test
    void shouldUseFilteredReadWithoutVectorIndex() {
        // Given
        EventQuery query = new EventQuery("jazz", null, null, null, List.of());
        List<Event> stored = List.of(event(1L, "music"));
        when(eventRepository.findByFilter(query)).thenReturn(stored);
        EventSearch search = new EventSearch(eventRepository, Optional.empty(), Optional.empty());

        // When
        List<Event> result = search.execute(query);

        // Then
        assertThat(result).isEqualTo(stored);
    }

    @Test
    void shouldUseFilteredReadForBlankText() {
        EventQuery query = EventQuery.all();
        when(eventRepository.findByFilter(query)).thenReturn(List.of());

        semanticSearch().execute(query);

        verifyNoInteractions(embeddingClient, vectorCollection);
    }

    @Test
    void shouldReturnVectorMatchesInSimilarityOrderFilteredByTags() {
        // Given
        EventQuery query = new EventQuery("late night jazz", LocalDate.of(2026, 4, 1), LocalDate.of(2026, 4, 30),
                new BigDecimal("40"), List.of("Music"));
        when(embeddingClient.embed("late night jazz")).thenReturn(List.of(0.3, 0.7));
        when(vectorCollection.query(List.of(0.3, 0.7), 20,
                new VectorFilter(LocalDate.of(2026, 4, 1), LocalDate.of(2026, 4, 30), new BigDecimal("40"))))
                .thenReturn(List.of(7L, 3L, 9L));
        when(eventRepository.findByIds(List.of(7L, 3L, 9L)))
                .thenReturn(List.of(event(7L, "music"), event(3L, "food"), event(9L, "music")));

        // When
        List<Event> result = semanticSearch().execute(query);

        // Then
        assertThat(result).extracting(Event::id).containsExactly(7L, 9L);
        verify(eventRepository, never()).findByFilter(any());
    }

    @Test
    void shouldReturnEmptyWhenVectorIndexHasNoMatch() {
        EventQuery query = new EventQuery("jazz", null, null, null, List.of());
        when(embeddingClient.embed("jazz")).thenReturn(List.of(0.1));
        when(vectorCollection.query(any(), anyInt(), any())).thenReturn(List.of());

        assertThat(semanticSearch().execute(query)).isEmpty();
        verify(eventRepository, never()).findByIds(any());
    }

    @Test
    void shouldFallBackToFilteredReadWhenEmbeddingFails() {
        // Given
        EventQuery query = new EventQuery("jazz", null, null, null, List.of());
        when(embeddingClient.embed("jazz")).thenThrow(new IllegalStateException("connection refused"));
        when(eventRepository.findByFilter(query)).thenReturn(List.of(event(4L, "music")));

        // When
        List<Event> result = semanticSearch().execute(query);

        // Then
        assertThat(result).extracting(Event::id).containsExactly(4L);
    }

    private EventSearch semanticSearch() {
        return new EventSearch(eventRepository, Optional.of(embeddingClient), Optional.of(vectorCollection));
    }

    private static Event event(Long id, String tag) {
        return new Event(id, "Event " + id, "", null, null, "", null, null, "",
                EventSource.SCRAPED, "s" + id, "{}", List.of(tag));
    }
}
