package io.specrouter.core.validator;

import static io.specrouter.core.testkit.TestContracts.standardContract;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.specrouter.core.error.ContractReadException;
import io.specrouter.core.error.InvalidJsonException;
import io.specrouter.core.error.OnlyOneEndpointAllowedException;
import io.specrouter.core.error.UnsupportedVersionException;
import io.specrouter.core.model.ContractDocument;
import io.specrouter.core.testkit.TestContracts;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link ValidatorChain}: ordering, read-only documents and fail-fast behaviour. */
class ValidatorChainTest {

    @TempDir
    Path tempDir;

    @Test
    void baselineAlwaysRunsFirst() {
        ValidatorChain chain = ValidatorChain.of(new StandardsValidator());

        assertThat(chain.names()).containsExactly("baseline", "standards");
    }

    @Test
    void explicitBaselineIsNotDuplicated() {
        ValidatorChain chain = ValidatorChain.of(new BaselineValidator(), new StandardsValidator());

        assertThat(chain.names()).containsExactly("baseline", "standards");
    }

    @Test
    void validatorsSeeCopiesTheyCannotLeakMutationsFrom() {
        List<JsonNode> seen = new ArrayList<>();
        ContractValidator mutating = recording("mutating", doc -> {
            ((ObjectNode) doc.root()).remove("paths");
            ((ObjectNode) doc.root()).put("openapi", "2.0");
        });
        ContractValidator observing = recording("observing", doc -> seen.add(doc.root()));
        ContractDocument document = TestContracts.document(standardContract());

        ValidatorChain.of(mutating, observing).validate(document);

        assertThat(seen).hasSize(1);
        assertThat(seen.get(0).has("paths")).isTrue();
        assertThat(seen.get(0).get("openapi").asText()).isEqualTo("3.0.2");
        assertThat(document.root().has("paths")).isTrue();
    }

    @Test
    void firstFailureStopsTheChain() {
        ContractValidator failing = mock(ContractValidator.class);
        ContractValidator later = mock(ContractValidator.class);
        when(failing.name()).thenReturn("failing");
        when(later.name()).thenReturn("later");
        doThrow(new OnlyOneEndpointAllowedException("two paths", "inline.json"))
                .when(failing)
                .validate(any());

        ValidatorChain chain = ValidatorChain.of(failing, later);

        assertThatThrownBy(() -> chain.validate(TestContracts.document(standardContract())))
                .isInstanceOf(OnlyOneEndpointAllowedException.class);
        verify(later, never()).validate(any());
    }

    @Test
    void unsupportedVersionRejectedByBaseline() {
        ObjectNode contract = standardContract();
        contract.put("openapi", "2.0");
        ContractValidator later = mock(ContractValidator.class);
        when(later.name()).thenReturn("later");

        assertThatThrownBy(() -> ValidatorChain.of(later).validate(TestContracts.document(contract)))
                .isInstanceOf(UnsupportedVersionException.class)
                .hasMessageContaining("2.0");
        verify(later, never()).validate(any());
    }

    @Test
    void missingVersionRejectedByBaseline() {
        ObjectNode contract = standardContract();
        contract.remove("openapi");

        assertThatThrownBy(() -> ValidatorChain.baseline().validate(TestContracts.document(contract)))
                .isInstanceOf(UnsupportedVersionException.class);
    }

    @Test
    void openApi31Accepted() {
        ObjectNode contract = standardContract();
        contract.put("openapi", "3.1.0");

        ValidatorChain.baseline().validate(TestContracts.document(contract));
    }

    @Test
    void validateLoadsDocumentFromFile() {
        Path file = TestContracts.write(tempDir.resolve("product.json"), standardContract());

        ContractDocument document = ValidatorChain.of(new StandardsValidator()).validate(file);

        assertThat(document.source()).isEqualTo(file);
        assertThat(document.root().path("paths").has("/Test/Product")).isTrue();
    }

    @Test
    void invalidJsonFileRejected() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{\"openapi\": ");

        assertThatThrownBy(() -> ValidatorChain.baseline().validate(file))
                .isInstanceOf(InvalidJsonException.class)
                .satisfies(e -> assertThat(((InvalidJsonException) e).source()).isEqualTo(file.toString()));
    }

    @Test
    void missingFileRejected() {
        assertThatThrownBy(() -> ValidatorChain.baseline().validate(tempDir.resolve("absent.json")))
                .isInstanceOf(ContractReadException.class);
    }

    private static ContractValidator recording(String name, Consumer<ContractDocument> action) {
        return new ContractValidator() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public void validate(ContractDocument document) {
                action.accept(document);
            }
        };
    }
}
