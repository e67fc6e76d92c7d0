package com.rockspec.generator.cmake;

import com.rockspec.generator.platform.Platform;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CMakeConfiguration setters.
 */
class CMakeConfigurationTest {

    private static final String UNKNOWN_PLATFORM_ERROR =
            "unsupported platform 'amiga': no build-tool equivalent defined";

    private CMakeConfiguration config;

    @BeforeEach
    void setUp() {
        config = new CMakeConfiguration("foo");
        config.addSupportedPlatform("unix");
        config.addUnsupportedPlatform("windows");
        config.setVariable("LUA_VERSION", "5.1");
        config.setVariable("CFLAGS", "-O2", "linux");
        config.addScriptTarget("foo.util");
        config.addScriptTarget("foo.extra", "macosx");
        config.addNativeTarget("foo.core");
        config.addNativeTarget("foo.epoll", "linux");
    }

    @Test
    void testDefaultScopeSetters() {
        assertThat(config.getPackageName()).isEqualTo("foo");
        assertThat(config.getVariables()).containsExactly(entry("LUA_VERSION", "5.1"));
        assertThat(config.getScriptTargets()).containsExactly("foo.util");
        assertThat(config.getNativeTargets()).containsExactly("foo.core");
        assertThat(config.hasErrors()).isFalse();
    }

    @Test
    void testPlatformScopeSetters() {
        assertThat(config.getSupportedPlatforms()).containsExactly(Platform.UNIX);
        assertThat(config.getUnsupportedPlatforms()).containsExactly(Platform.WINDOWS);
        assertThat(config.getPlatformVariables()).containsOnlyKeys(Platform.LINUX);
        assertThat(config.getPlatformVariables().get(Platform.LINUX)).containsExactly(entry("CFLAGS", "-O2"));
        assertThat(config.getPlatformScriptTargets().get(Platform.MACOSX)).containsExactly("foo.extra");
        assertThat(config.getPlatformNativeTargets().get(Platform.LINUX)).containsExactly("foo.epoll");
    }

    @Test
    void testNullPlatformSelectsDefaultScope() {
        config.setVariable("PREFIX", "/usr", null);
        config.addScriptTarget("foo.more", null);
        config.addNativeTarget("foo.fast", null);

        assertThat(config.getVariables()).containsEntry("PREFIX", "/usr");
        assertThat(config.getScriptTargets()).containsExactly("foo.util", "foo.more");
        assertThat(config.getNativeTargets()).containsExactly("foo.core", "foo.fast");
    }

    @Test
    void testInvalidPlatformOnSupportedPlatforms() {
        assertOnlyErrorRecorded(c -> c.addSupportedPlatform("amiga"));
    }

    @Test
    void testInvalidPlatformOnUnsupportedPlatforms() {
        assertOnlyErrorRecorded(c -> c.addUnsupportedPlatform("amiga"));
    }

    @Test
    void testInvalidPlatformOnVariable() {
        assertOnlyErrorRecorded(c -> c.setVariable("CFLAGS", "-O3", "amiga"));
    }

    @Test
    void testInvalidPlatformOnScriptTarget() {
        assertOnlyErrorRecorded(c -> c.addScriptTarget("foo.amiga", "amiga"));
    }

    @Test
    void testInvalidPlatformOnNativeTarget() {
        assertOnlyErrorRecorded(c -> c.addNativeTarget("foo.amiga", "amiga"));
    }

    @Test
    void testFatalErrorsKeepInsertionOrder() {
        config.recordFatalError("first");
        config.recordFatalError("second");
        config.recordFatalError("first");

        assertThat(config.getErrors()).containsExactly("first", "second", "first");
        assertThat(config.hasErrors()).isTrue();
    }

    @Test
    void testDuplicateTargetsArePreserved() {
        config.addScriptTarget("foo.util");
        config.addNativeTarget("foo.epoll", "linux");

        assertThat(config.getScriptTargets()).containsExactly("foo.util", "foo.util");
        assertThat(config.getPlatformNativeTargets().get(Platform.LINUX)).containsExactly("foo.epoll", "foo.epoll");
    }

    @Test
    void testPlatformInBothListsIsKept() {
        config.addUnsupportedPlatform("unix");

        assertThat(config.getSupportedPlatforms()).contains(Platform.UNIX);
        assertThat(config.getUnsupportedPlatforms()).contains(Platform.UNIX);
        assertThat(config.hasErrors()).isFalse();
    }

    @Test
    void testVariableRedefinitionReplacesValue() {
        config.setVariable("LUA_VERSION", "5.3");

        assertThat(config.getVariables()).containsExactly(entry("LUA_VERSION", "5.3"));
    }

    @Test
    void testViewsAreReadOnly() {
        assertThatThrownBy(() -> config.getErrors().add("x"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> config.getScriptTargets().clear())
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> config.getVariables().put("A", "B"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testPlatformViewsAreReadOnlyAllTheWayDown() {
        config.setVariable("CFLAGS", "-O2", "linux");
        config.addScriptTarget("foo.posix", "linux");
        config.addNativeTarget("foo.epoll", "linux");

        assertThatThrownBy(() -> config.getPlatformVariables().get(Platform.LINUX).put("INJECTED", "x"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> config.getPlatformScriptTargets().get(Platform.LINUX).add("foo.injected"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> config.getPlatformNativeTargets().get(Platform.LINUX).clear())
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> config.getPlatformVariables().remove(Platform.LINUX))
                .isInstanceOf(UnsupportedOperationException.class);

        assertThat(config.getPlatformVariables().get(Platform.LINUX)).containsOnlyKeys("CFLAGS");
        assertThat(config.getPlatformScriptTargets().get(Platform.LINUX)).containsExactly("foo.posix");
        assertThat(config.getPlatformNativeTargets().get(Platform.LINUX)).containsExactly("foo.epoll");
    }

    @Test
    void testPackageNameIsRequired() {
        assertThatThrownBy(() -> new CMakeConfiguration(null))
                .isInstanceOf(NullPointerException.class);
    }

    private void assertOnlyErrorRecorded(Consumer<CMakeConfiguration> setter) {
        Snapshot before = Snapshot.of(config);

        setter.accept(config);

        assertThat(config.getErrors()).containsExactly(UNKNOWN_PLATFORM_ERROR);
        assertThat(Snapshot.of(config)).isEqualTo(before);
    }

    /**
     * Everything but the errors, deep-copied.
     */
    private record Snapshot(List<Platform> supported, List<Platform> unsupported,
                            Map<String, String> variables, Map<Platform, Map<String, String>> platformVariables,
                            List<String> scriptTargets, Map<Platform, List<String>> platformScriptTargets,
                            List<String> nativeTargets, Map<Platform, List<String>> platformNativeTargets) {

        static Snapshot of(CMakeConfiguration c) {
            Map<Platform, Map<String, String>> platformVariables = new LinkedHashMap<>();
            c.getPlatformVariables().forEach((p, v) -> platformVariables.put(p, new LinkedHashMap<>(v)));
            return new Snapshot(
                    new ArrayList<>(c.getSupportedPlatforms()),
                    new ArrayList<>(c.getUnsupportedPlatforms()),
                    new LinkedHashMap<>(c.getVariables()),
                    platformVariables,
                    new ArrayList<>(c.getScriptTargets()),
                    copyTargets(c.getPlatformScriptTargets()),
                    new ArrayList<>(c.getNativeTargets()),
                    copyTargets(c.getPlatformNativeTargets()));
        }

        private static Map<Platform, List<String>> copyTargets(Map<Platform, List<String>> targets) {
            Map<Platform, List<String>> copy = new LinkedHashMap<>();
            targets.forEach((p, names) -> copy.put(p, new ArrayList<>(names)));
            return copy;
        }
    }
}
