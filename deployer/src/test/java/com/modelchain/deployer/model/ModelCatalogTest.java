package com.modelchain.deployer.model;

import com.modelchain.deployer.models.IrisModel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelCatalogTest {

    @Test
    void catalog_registersModelsByQualifiedName() {
        IrisModel     iris     = new IrisModel();
        DoublingModel doubling = new DoublingModel();

        ModelCatalog catalog = new ModelCatalog(List.of(iris, doubling));

        assertThat(catalog.modelNames()).containsExactly("doubling_model", "iris_model");
        assertThat(catalog.get("iris_model")).isSameAs(iris);
        assertThat(catalog.all()).containsExactly(iris, doubling);
    }

    @Test
    void get_unknownModel_throwsNotFoundException() {
        ModelCatalog catalog = new ModelCatalog(List.of(new DoublingModel()));

        assertThatThrownBy(() -> catalog.get("iris_model"))
                .isInstanceOf(ModelNotFoundException.class)
                .hasMessageContaining("iris_model");
    }

    @Test
    void duplicateQualifiedNames_areRejected() {
        assertThatThrownBy(() -> new ModelCatalog(List.of(new DoublingModel(), new DoublingModel())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("doubling_model");
    }
}
