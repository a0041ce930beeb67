package org.radiant.filesystem;

import org.radiant.error.NotFoundException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExternDirectoryTest {

    private final FileSystem host = FileSystem.withRootDirectory("host");
    private final FileSystem target = FileSystem.withRootDirectory("target");

    @Test
    void addEntry_landsInTargetRoot() {
        ExternDirectory mount = host.createMount(target);
        host.link(host.getRootDirectory(), "mnt", mount);

        File f = target.createFile(new byte[]{1});
        Entry<File> entry = new Entry<>(target, "a.txt", f);
        mount.addEntry(entry);
        target.addEntry(entry);

        assertThat(target.getRoot().orElseThrow().getNode(Directory.class).getEntries()).containsExactly(entry);
        assertThat(mount.getEntries()).containsExactly(entry);
        assertThat(mount.getEntry("a.txt")).isSameAs(entry);
        assertThat(entry.getParent()).contains(target.getRootDirectory());
        assertThat(f.getReferences()).isEqualTo(1);
    }

    @Test
    void ownListing_staysUnused() {
        ExternDirectory mount = host.createMount(target);
        target.link(mount, "x", target.createDirectory());

        assertThat(mount.getData()).isEmpty();
        assertThat(target.getRootDirectory().containsEntry("x")).isTrue();
        assertThat(mount.listingFileSystem()).isSameAs(target);
        assertThat(mount.getTarget()).isSameAs(target);
    }

    @Test
    void removeEntry_forwardsToTarget() {
        ExternDirectory mount = host.createMount(target);
        Entry<File> entry = target.link(target.getRootDirectory(), "f", target.createFile(new byte[0]));

        assertThat(mount.containsEntry("f")).isTrue();
        assertThat(mount.removeEntry("f")).isSameAs(entry);
        assertThat(target.getRootDirectory().isEmpty()).isTrue();
        assertThat(mount.isEmpty()).isTrue();
    }

    @Test
    void removeEntryFromTarget_isVisibleThroughMount() {
        ExternDirectory mount = host.createMount(target);
        Entry<File> entry = target.link(mount, "f", target.createFile(new byte[0]));

        target.removeEntry(entry.getId());

        assertThatThrownBy(() -> mount.getEntry("f")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void forwarding_failsWhenTargetHasNoRoot() {
        ExternDirectory mount = host.createMount(new FileSystem("bare"));

        assertThatThrownBy(mount::getEntries).isInstanceOf(NotFoundException.class);
    }
}
