package cafe.woden.linkvault.architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

@AnalyzeClasses(
    packages = "cafe.woden.linkvault",
    importOptions = {ImportOption.DoNotIncludeTests.class})
class ArchitectureGuardrailsTest {

  @ArchTest
  static final ArchRule hierarchy_should_stay_pure =
      noClasses()
          .that()
          .resideInAPackage("cafe.woden.linkvault.hierarchy..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(
              "io.reactivex.rxjava3..",
              "cafe.woden.linkvault.data..",
              "cafe.woden.linkvault.session..",
              "cafe.woden.linkvault.store..")
          .because("parentage rules are plain functions over a folder snapshot");

  @ArchTest
  static final ArchRule realtime_should_not_touch_application_data =
      noClasses()
          .that()
          .resideInAPackage("cafe.woden.linkvault.realtime..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(
              "cafe.woden.linkvault.store..",
              "cafe.woden.linkvault.data..",
              "cafe.woden.linkvault.mode..")
          .because("the subscription manager forwards events; the sync binder decides what they mean");

  @ArchTest
  static final ArchRule session_should_not_know_about_modes_or_feeds =
      noClasses()
          .that()
          .resideInAPackage("cafe.woden.linkvault.session..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(
              "cafe.woden.linkvault.mode..",
              "cafe.woden.linkvault.realtime..",
              "cafe.woden.linkvault.broadcast..",
              "cafe.woden.linkvault.auth..")
          .because("other components follow session state, not the other way round");

  @ArchTest
  static final ArchRule only_loopback_implements_all_backend_ports =
      noClasses()
          .that()
          .resideOutsideOfPackage("cafe.woden.linkvault.loopback..")
          .and()
          .resideOutsideOfPackage("cafe.woden.linkvault")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("cafe.woden.linkvault.loopback..")
          .because("production code talks to backend ports, never to the in-memory backend");

  @ArchTest
  static final ArchRule commands_should_go_through_the_reconciler =
      noClasses()
          .that()
          .resideInAPackage("cafe.woden.linkvault.commands..")
          .should()
          .dependOnClassesThat()
          .haveSimpleNameStartingWith("Guest")
          .orShould()
          .dependOnClassesThat()
          .haveSimpleNameStartingWith("Remote")
          .because("commands write to whichever repository the mode reconciler says is active");
}
