package com.example.analytics.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.example.analytics.repository.MatchRepository;
import com.example.analytics.repository.UserMatchRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class MatchDataServiceTest {

  @Mock private MatchRepository matchRepository;
  @Mock private UserMatchRepository userMatchRepository;

  @InjectMocks private MatchDataService service;

  @Test
  void deleteGuildDataReturnsDeletedMatches() {
    when(matchRepository.deleteAllForGuild(10L)).thenReturn(3);

    assertThat(service.deleteGuildData(10L)).isEqualTo(3);
  }

  @Test
  void deleteUserDataPropagatesStoreFailure() {
    when(userMatchRepository.deleteAllForUser(1L))
        .thenThrow(new DataAccessResourceFailureException("down"));

    assertThatThrownBy(() -> service.deleteUserData(1L))
        .isInstanceOf(DataAccessResourceFailureException.class);
  }
}
