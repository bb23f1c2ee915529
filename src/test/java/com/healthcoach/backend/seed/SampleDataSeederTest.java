package com.healthcoach.backend.seed;

import com.healthcoach.backend.users.profile.entity.UserProfile;
import com.healthcoach.backend.users.profile.repo.UserProfileRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SampleDataSeederTest {

    @Mock UserProfileRepository repo;

    @InjectMocks SampleDataSeeder seeder;

    @Test
    void seed_shouldInsertOnlyMissingProfiles() {
        when(repo.existsById(1L)).thenReturn(true);
        when(repo.existsById(2L)).thenReturn(false);

        seeder.seed();

        ArgumentCaptor<UserProfile> captor = ArgumentCaptor.forClass(UserProfile.class);
        verify(repo, times(1)).save(captor.capture());
        UserProfile jane = captor.getValue();
        assertThat(jane.getUserId()).isEqualTo(2L);
        assertThat(jane.getDietaryRestrictions()).containsExactly("vegetarian");
        assertThat(jane.getActivityLevel()).isEqualTo("lightly_active");
    }

    @Test
    void seed_failure_shouldNotPropagate() {
        when(repo.existsById(any())).thenThrow(new IllegalStateException("db down"));

        assertThatCode(() -> seeder.seed()).doesNotThrowAnyException();
        verify(repo, never()).save(any());
    }
}
