package io.specrouter.core.route;

import static io.specrouter.core.testkit.TestContracts.COFFEE_PATH;
import static io.specrouter.core.testkit.TestContracts.COMPANY_PATH;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.specrouter.core.error.ModelGenerationException;
import io.specrouter.core.error.RouteConfigurationException;
import io.specrouter.core.error.UnknownRouteException;
import io.specrouter.core.error.UnsupportedMethodException;
import io.specrouter.core.model.ContractDocument;
import io.specrouter.core.model.HttpMethod;
import io.specrouter.core.model.PathItem;
import io.specrouter.core.schema.GeneratedModelModule;
import io.specrouter.core.schema.GeneratorOptions;
import io.specrouter.core.schema.ModelGenerator;
import io.specrouter.core.schema.ModelType;
import io.specrouter.core.spec.ContractParser;
import io.specrouter.core.testkit.TestContracts;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RouteTableBuilderTest {

    private static final RouteHandler ECHO = (body, context) -> body.json();

    private RouteTableBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new RouteTableBuilder();
        add(builder, TestContracts.COFFEE);
        add(builder, TestContracts.COMPANY);
    }

    private static void add(RouteTableBuilder builder, Path contract) {
        ContractDocument document = ContractDocument.load(contract);
        Map<String, PathItem> paths = new ContractParser().parse(document);
        GeneratedModelModule module = new ModelGenerator()
                .generate(document, paths.keySet().iterator().next(), GeneratorOptions.defaults());
        builder.addContract(paths, module, contract.toString());
    }

    private Route coffee(RouteTable table) {
        return table.route(COFFEE_PATH, HttpMethod.POST).orElseThrow();
    }

    @Nested
    @DisplayName("contract-derived routes")
    class ContractDerived {

        @Test
        void routeCarriesOperationMetadata() {
            Route route = coffee(builder.build());

            assertThat(route.name()).isEqualTo("request_Appliance_CoffeeBrewer");
            assertThat(route.summary()).isEqualTo("Brew coffee");
            assertThat(route.description()).isEqualTo("Controls a networked coffee brewer");
            assertThat(route.tags()).containsExactly("Coffee");
            assertThat(route.deprecated()).isTrue();
            assertThat(route.responseDescription()).isEqualTo("Coffee brewing started");
            assertThat(route.requestModel().name()).isEqualTo("CoffeeBrewingRequest");
            assertThat(route.responseModel().name()).isEqualTo("CoffeeBrewingResponse");
            assertThat(route.headers()).containsOnlyKeys("authorization", "x-authorization-provider");
            assertThat(route.source()).endsWith("CoffeeBrewer.json");
        }

        @Test
        void nonOkResponsesBecomeAdditionalResponses() {
            Route route = coffee(builder.build());

            assertThat(route.responses()).containsOnlyKeys(418);
            AdditionalResponse teapot = route.responses().get(418);
            assertThat(teapot.description()).isEqualTo("I'm a teapot");
            assertThat(teapot.model().name()).isEqualTo("TeapotResponse");
        }

        @Test
        void defaultHandlerReturnsEmptyObject() {
            Route route = coffee(builder.build());

            Object result = route.handler().handle(null, null);

            assertThat(result).hasToString("{}");
        }

        @Test
        void operationWithoutRequestBodyGetsEmptyBodyModel() {
            RouteTableBuilder local = new RouteTableBuilder();
            var contract = TestContracts.standardContract();
            TestContracts.post(contract).remove("requestBody");
            ((ObjectNode) TestContracts.post(contract).path("responses").path("200"))
                    .remove("description");
            ContractDocument document = TestContracts.document(contract);
            local.addContract(
                    new ContractParser().parse(document),
                    new ModelGenerator().generate(document, "/Test/Product", GeneratorOptions.defaults()),
                    "inline.json");

            Route route = local.build().route("/Test/Product", HttpMethod.POST).orElseThrow();

            assertThat(route.requestModel()).isSameAs(ModelType.emptyBody());
            assertThat(route.responseDescription()).isEqualTo("Successful response");
        }

        @Test
        void unresolvedModelOnNonOkResponseIsDocumentedWithoutSchema() {
            RouteTableBuilder local = new RouteTableBuilder();
            var contract = TestContracts.standardContract();
            ((ObjectNode) TestContracts.post(contract).path("responses"))
                    .set("404", TestContracts.parse("""
                            {
                              "description": "Not found",
                              "content": {
                                "application/json": {"schema": {"$ref": "#/components/schemas/Missing"}}
                              }
                            }
                            """));
            ContractDocument document = TestContracts.document(contract);
            local.addContract(
                    new ContractParser().parse(document),
                    new ModelGenerator().generate(document, "/Test/Product", GeneratorOptions.defaults()),
                    "inline.json");

            Route route = local.build().route("/Test/Product", HttpMethod.POST).orElseThrow();

            assertThat(route.responseModel().name()).isEqualTo("TestResponse");
            assertThat(route.responses()).containsOnlyKeys(404);
            assertThat(route.responses().get(404).description()).isEqualTo("Not found");
            assertThat(route.responses().get(404).model()).isNull();
        }

        @Test
        void unresolvedModelOnOkResponseRejected() {
            RouteTableBuilder local = new RouteTableBuilder();
            var contract = TestContracts.standardContract();
            ((ObjectNode) TestContracts.post(contract)
                            .path("responses")
                            .path("200")
                            .path("content")
                            .path("application/json")
                            .path("schema"))
                    .put("$ref", "#/components/schemas/Missing");
            ContractDocument document = TestContracts.document(contract);
            GeneratedModelModule module =
                    new ModelGenerator().generate(document, "/Test/Product", GeneratorOptions.defaults());
            Map<String, PathItem> paths = new ContractParser().parse(document);

            assertThatThrownBy(() -> local.addContract(paths, module, "inline.json"))
                    .isInstanceOf(ModelGenerationException.class)
                    .hasMessageContaining("Missing");
        }

        @Test
        void duplicatePathAcrossContractsRejected() {
            assertThatThrownBy(() -> add(builder, TestContracts.COFFEE))
                    .isInstanceOf(RouteConfigurationException.class)
                    .hasMessageContaining(COFFEE_PATH);
        }
    }

    @Nested
    @DisplayName("override precedence")
    class Precedence {

        @Test
        void perPathValueWinsOverDefaultAndContract() {
            builder.registerDefault(HttpMethod.POST, new RouteInfo().summary("default summary"));
            builder.register(HttpMethod.POST, COFFEE_PATH, new RouteInfo().summary("path summary"));

            assertThat(coffee(builder.build()).summary()).isEqualTo("path summary");
        }

        @Test
        void nullPerPathFieldFallsBackToDefault() {
            builder.registerDefault(HttpMethod.POST, new RouteInfo().summary("default summary").handler(ECHO));
            builder.register(HttpMethod.POST, COFFEE_PATH, new RouteInfo().description("path description"));

            RouteTable table = builder.build();

            assertThat(coffee(table).summary()).isEqualTo("default summary");
            assertThat(coffee(table).description()).isEqualTo("path description");
            assertThat(coffee(table).handler()).isSameAs(ECHO);
            assertThat(table.route(COMPANY_PATH, HttpMethod.POST).orElseThrow().handler()).isSameAs(ECHO);
        }

        @Test
        void contractFillsWhatNoRegistrationSets() {
            builder.registerDefault(HttpMethod.POST, new RouteInfo().tags(List.of("Appliances")));

            Route route = coffee(builder.build());

            assertThat(route.tags()).containsExactly("Appliances");
            assertThat(route.summary()).isEqualTo("Brew coffee");
            assertThat(route.deprecated()).isTrue();
        }

        @Test
        void explicitFalseOverridesContractFlag() {
            builder.register(HttpMethod.POST, COFFEE_PATH, new RouteInfo().deprecated(false));

            assertThat(coffee(builder.build()).deprecated()).isFalse();
        }

        @Test
        void nameFactoryBeatsLiteralName() {
            builder.register(HttpMethod.POST, COFFEE_PATH, new RouteInfo().name("literal"));
            builder.registerDefault(HttpMethod.POST, new RouteInfo()
                    .nameFactory((path, operation) -> operation.method().key() + path.replace('/', '_')));

            assertThat(coffee(builder.build()).name()).isEqualTo("post_Appliance_CoffeeBrewer");
        }

        @Test
        void literalNameWinsOverOperationId() {
            builder.register(HttpMethod.POST, COFFEE_PATH, new RouteInfo().name("brew"));

            Route route = coffee(builder.build());

            assertThat(route.name()).isEqualTo("brew");
        }

        @Test
        void summaryFallsBackToResolvedName() {
            RouteTableBuilder local = new RouteTableBuilder();
            var contract = TestContracts.standardContract();
            ContractDocument document = TestContracts.document(contract);
            local.addContract(
                    new ContractParser().parse(document),
                    new ModelGenerator().generate(document, "/Test/Product", GeneratorOptions.defaults()),
                    "inline.json");

            Route route = local.build().route("/Test/Product", HttpMethod.POST).orElseThrow();

            assertThat(route.summary()).isEqualTo("request_Test_Product");
        }

        @Test
        void nameFallsBackToPathWithoutOperationId() {
            RouteTableBuilder local = new RouteTableBuilder();
            var contract = TestContracts.standardContract();
            TestContracts.post(contract).remove("operationId");
            ContractDocument document = TestContracts.document(contract);
            local.addContract(
                    new ContractParser().parse(document),
                    new ModelGenerator().generate(document, "/Test/Product", GeneratorOptions.defaults()),
                    "inline.json");

            assertThat(local.build().route("/Test/Product", HttpMethod.POST).orElseThrow().name())
                    .isEqualTo("/Test/Product");
        }

        @Test
        void registrationsAreFrozenAfterBuild() {
            RouteInfo info = new RouteInfo().summary("before");
            builder.register(HttpMethod.POST, COFFEE_PATH, info);
            builder.build();

            assertThat(info.isFrozen()).isTrue();
            assertThatThrownBy(() -> info.summary("after")).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> builder.registerDefault(HttpMethod.POST, new RouteInfo()))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        void registeredInstanceNotMutatedByResolution() {
            RouteInfo info = new RouteInfo().summary("only summary");
            builder.register(HttpMethod.POST, COFFEE_PATH, info);
            builder.build();

            assertThat(info.description()).isNull();
            assertThat(info.handler()).isNull();
        }
    }

    @Test
    void registeringUndeclaredRouteFailsImmediately() {
        assertThatThrownBy(() -> builder.register(HttpMethod.GET, COFFEE_PATH, new RouteInfo()))
                .isInstanceOfSatisfying(UnknownRouteException.class, e -> {
                    assertThat(e.path()).isEqualTo(COFFEE_PATH);
                    assertThat(e.method()).isEqualTo("GET");
                });
        assertThatThrownBy(() -> builder.register(HttpMethod.POST, "/Nope", new RouteInfo()))
                .isInstanceOf(UnknownRouteException.class);
    }

    @Test
    void lookupByUnsupportedMethodRejected() {
        RouteTable table = builder.build();

        assertThatThrownBy(() -> table.route(COFFEE_PATH, "put"))
                .isInstanceOf(UnsupportedMethodException.class)
                .hasMessageContaining("put");
        assertThatThrownBy(() -> table.responseModel(COFFEE_PATH, "PUT")).isInstanceOf(UnsupportedMethodException.class);
        assertThat(table.responseModel(COFFEE_PATH, "post")).get().extracting(ModelType::name)
                .isEqualTo("CoffeeBrewingResponse");
        assertThat(table.route(COFFEE_PATH, "get")).isEmpty();
    }

    @Test
    void tableListsRoutesInContractOrder() {
        RouteTable table = builder.build();

        assertThat(table.routes()).extracting(Route::path).containsExactly(COFFEE_PATH, COMPANY_PATH);
        assertThat(table.size()).isEqualTo(2);
        assertThat(table.modules()).hasSize(2);
        assertThat(builder.paths(HttpMethod.POST)).containsExactly(COFFEE_PATH, COMPANY_PATH);
    }

    @Test
    void registerWithHandsEveryRouteToTheTransport() {
        List<Route> registered = new ArrayList<>();

        builder.build().registerWith(registered::add);

        assertThat(registered).hasSize(2);
    }
}
