package cafe.woden.logkeeper.architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

@AnalyzeClasses(
    packages = "cafe.woden.logkeeper",
    importOptions = {ImportOption.DoNotIncludeTests.class})
class ArchitectureGuardrailsTest {

  @ArchTest
  static final ArchRule reader_should_only_know_the_handler_contract =
      noClasses()
          .that()
          .resideInAPackage("cafe.woden.logkeeper.reader..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("cafe.woden.logkeeper.handler..", "cafe.woden.logkeeper.config..")
          .because("queries must work against any backend through the LogHandler contract");

  @ArchTest
  static final ArchRule logger_should_only_know_the_handler_contract =
      noClasses()
          .that()
          .resideInAPackage("cafe.woden.logkeeper.logger..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("cafe.woden.logkeeper.handler..", "cafe.woden.logkeeper.config..")
          .because("the logger dispatches to whatever handler it was given");

  @ArchTest
  static final ArchRule handlers_should_not_depend_on_logger_or_reader =
      noClasses()
          .that()
          .resideInAPackage("cafe.woden.logkeeper.handler..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(
              "cafe.woden.logkeeper.logger..",
              "cafe.woden.logkeeper.reader..",
              "cafe.woden.logkeeper.config..")
          .because("handlers are leaf components of the write and read paths");

  @ArchTest
  static final ArchRule model_and_api_should_stay_free_of_spring =
      noClasses()
          .that()
          .resideInAnyPackage("cafe.woden.logkeeper.model..", "cafe.woden.logkeeper.api..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("org.springframework..")
          .because("the contract is usable without a Spring context");
}
