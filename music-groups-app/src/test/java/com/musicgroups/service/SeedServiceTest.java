package com.musicgroups.service;

import com.musicgroups.model.MusicGroup;
import com.musicgroups.service.SeedService.SeedInfo;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;
import org.springframework.transaction.annotation.Transactional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Sql(scripts = "/music-groups.sql", executionPhase = Sql.ExecutionPhase.BEFORE_TEST_METHOD)
@Transactional
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
class SeedServiceTest {

    @Autowired
    private SeedService seedService;

    @Autowired
    private MusicGroupsService groupsService;

    @Test
    void infoCountsFixtureGroups() {
        SeedInfo info = seedService.info();

        assertThat(info.nrSeededGroups()).isEqualTo(2);
        assertThat(info.nrUnseededGroups()).isEqualTo(1);
        assertThat(info.nrOfGroups()).isEqualTo(3);
    }

    @Test
    void seededGroupsComeWithChildren() {
        seedService.removeSeeds(true);

        SeedInfo info = seedService.seed(4);

        assertThat(info.nrSeededGroups()).isEqualTo(4);
        assertThat(info.nrUnseededGroups()).isEqualTo(1);
        for (MusicGroup group : groupsService.readMusicGroups(true, null, 0, 20).items()) {
            MusicGroup aggregate = groupsService.readMusicGroupAggregate(group.id());
            assertThat(aggregate.albums()).isNotEmpty();
            assertThat(aggregate.artists()).isNotEmpty();
        }
    }

    @Test
    void removeSeedsKeepsUserCreatedGroups() {
        int removed = seedService.removeSeeds(true);

        assertThat(removed).isEqualTo(2);
        SeedInfo info = seedService.info();
        assertThat(info.nrSeededGroups()).isZero();
        assertThat(info.nrUnseededGroups()).isEqualTo(1);
    }

    @Test
    void negativeCountIsRejected() {
        assertThatThrownBy(() -> seedService.seed(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
