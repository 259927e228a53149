package com.shiptivity.board.application.service;

import com.shiptivity.board.application.port.ClientPort;
import com.shiptivity.board.core.exception.InvalidLaneException;
import com.shiptivity.board.core.exception.InvalidPriorityException;
import com.shiptivity.board.core.exception.StoreException;
import com.shiptivity.board.core.model.Client;
import com.shiptivity.board.core.model.Lane;
import com.shiptivity.board.core.ranking.DenseRanking;
import com.shiptivity.board.core.ranking.RerankingEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ClientServiceTest {

    @Mock
    private ClientPort clientPort;

    @Captor
    private ArgumentCaptor<List<Client>> saved;

    private ClientService clientService;

    private final List<Client> seed = BoardSeed.clients();

    @BeforeEach
    void setUp() {
        clientService = new ClientService(clientPort, new ClientValidator(clientPort), new RerankingEngine());
    }

    private void boardIsSeeded() {
        when(clientPort.findById(anyLong())).thenAnswer(inv -> {
            long id = inv.getArgument(0);
            return seed.stream().filter(c -> c.getId() == id).findFirst().orElse(null);
        });
        when(clientPort.findAll()).thenReturn(seed);
    }

    @Test
    @DisplayName("Seed board is densely ranked")
    void seedBoardIsDenselyRanked() {
        assertThat(seed).hasSize(20);
        assertThat(DenseRanking.isDense(seed)).isTrue();
    }

    @Test
    @DisplayName("Update writes the reranked board")
    void updatePersistsRerankedBoard() {
        boardIsSeeded();

        // client 6 is second in backlog; in-progress holds five clients
        List<Client> result = clientService.updateClient("6", "in-progress", null);

        verify(clientPort).saveAll(saved.capture());
        assertThat(saved.getValue()).isEqualTo(result);

        Client moved = result.stream().filter(c -> c.getId() == 6).findFirst().orElseThrow();
        assertThat(moved.getLane()).isEqualTo(Lane.IN_PROGRESS);
        assertThat(moved.getRank()).isEqualTo(6);
        assertThat(DenseRanking.isDense(result)).isTrue();
    }

    @Test
    @DisplayName("No-op update writes nothing")
    void noOpWritesNothing() {
        boardIsSeeded();

        List<Client> result = clientService.updateClient("5", null, "3");

        assertThat(result).isEqualTo(seed);
        verify(clientPort, never()).saveAll(anyList());
    }

    @Test
    @DisplayName("Invalid priority stops before the board is read")
    void invalidPriorityStopsBeforeReranking() {
        when(clientPort.findById(3L)).thenReturn(seed.get(2));

        assertThatThrownBy(() -> clientService.updateClient("3", "complete", "0"))
                .isInstanceOf(InvalidPriorityException.class);
        verify(clientPort, never()).findAll();
        verify(clientPort, never()).saveAll(anyList());
    }

    @Test
    @DisplayName("Store failure propagates to the caller")
    void storeFailurePropagates() {
        boardIsSeeded();
        doThrow(new StoreException("disk full", null)).when(clientPort).saveAll(any());

        assertThatThrownBy(() -> clientService.updateClient("1", "complete", "1"))
                .isInstanceOf(StoreException.class);
    }

    @Test
    @DisplayName("Lane filter reads only that lane")
    void listFiltersByLane() {
        List<Client> complete = seed.stream().filter(c -> c.getLane() == Lane.COMPLETE).toList();
        when(clientPort.findByLane(Lane.COMPLETE)).thenReturn(complete);

        assertThat(clientService.listClients("complete")).isEqualTo(complete);
        verify(clientPort, never()).findAll();
    }

    @Test
    @DisplayName("Unknown lane filter is rejected")
    void listRejectsUnknownLane() {
        assertThatThrownBy(() -> clientService.listClients("archived"))
                .isInstanceOf(InvalidLaneException.class);
    }

    @Test
    @DisplayName("Priority beyond int range clamps to the bottom of the lane")
    void oversizedPriorityClampsToBottomOfLane() {
        boardIsSeeded();

        // backlog holds eleven clients, so client 2 joins at twelve
        List<Client> result = clientService.updateClient("2", "backlog", "2147483648");

        Client moved = result.stream().filter(c -> c.getId() == 2).findFirst().orElseThrow();
        assertThat(moved.getLane()).isEqualTo(Lane.BACKLOG);
        assertThat(moved.getRank()).isEqualTo(12);
        assertThat(DenseRanking.isDense(result)).isTrue();
    }

    @Test
    @DisplayName("Reset replaces the store with the seed board")
    void resetBoardReplacesStoreWithSeed() {
        List<Client> result = clientService.resetBoard();

        verify(clientPort).replaceAll(seed);
        assertThat(result).isEqualTo(seed);
    }
}
