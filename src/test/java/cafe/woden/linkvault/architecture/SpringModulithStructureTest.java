package cafe.woden.linkvault.architecture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import cafe.woden.linkvault.LinkVaultApp;
import cafe.woden.linkvault.auth.BroadcastSync;
import cafe.woden.linkvault.hierarchy.FolderHierarchy;
import cafe.woden.linkvault.mode.ModeReconciler;
import cafe.woden.linkvault.realtime.RealtimeSubscriptionManager;
import cafe.woden.linkvault.session.SessionRecoveryService;
import org.junit.jupiter.api.Test;
import org.springframework.modulith.core.ApplicationModule;
import org.springframework.modulith.core.ApplicationModules;

class SpringModulithStructureTest {

  @Test
  void applicationModulesCanBeDiscovered() {
    assertThatCode(() -> ApplicationModules.of(LinkVaultApp.class)).doesNotThrowAnyException();
  }

  @Test
  void componentsResolveToTheirOwnModules() {
    ApplicationModules modules = ApplicationModules.of(LinkVaultApp.class);

    assertThat(moduleFor(modules, FolderHierarchy.class).getBasePackage().getName())
        .isEqualTo("cafe.woden.linkvault.hierarchy");
    assertThat(moduleFor(modules, SessionRecoveryService.class).getBasePackage().getName())
        .isEqualTo("cafe.woden.linkvault.session");
    assertThat(moduleFor(modules, RealtimeSubscriptionManager.class).getBasePackage().getName())
        .isEqualTo("cafe.woden.linkvault.realtime");
    assertThat(moduleFor(modules, BroadcastSync.class).getBasePackage().getName())
        .isEqualTo("cafe.woden.linkvault.auth");
    assertThat(moduleFor(modules, ModeReconciler.class).getBasePackage().getName())
        .isEqualTo("cafe.woden.linkvault.mode");
  }

  @Test
  void moduleDependenciesHaveNoCycles() {
    ApplicationModules.of(LinkVaultApp.class).verify();
  }

  private static ApplicationModule moduleFor(ApplicationModules modules, Class<?> type) {
    return modules
        .getModuleByType(type)
        .orElseThrow(() -> new AssertionError("No module found for " + type.getName()));
  }
}
