package com.plcmodel.core.locator;

import com.plcmodel.core.config.ExtractorConfig;
import com.plcmodel.core.diagnostics.DiagnosticLog;
import com.plcmodel.core.diagnostics.DiagnosticType;
import com.plcmodel.core.document.DocumentNode;
import com.plcmodel.core.document.DocumentTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link StructureLocator}.
 */
class StructureLocatorTest extends DocumentTestBase {

    private DiagnosticLog diagnostics;
    private StructureLocator locator;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticLog();
        locator = new StructureLocator(query, ExtractorConfig.defaults().namespaces(), diagnostics);
    }

    @Test
    void locateApplicationSubtrees_blockPresent_usesFirstTierOnly() {
        DocumentNode root = project("""
            <instances><configurations><configuration name="PLC">
              <resource name="Outside"><dataType name="T_Outside"><baseType><INT/></baseType></dataType></resource>
            </configuration></configurations></instances>
            <addData>
              <data name="%s">
                <resource name="Inside"><dataType name="T_Inside"><baseType><INT/></baseType></dataType></resource>
              </data>
            </addData>
            """.formatted(APPLICATION_BLOCK));

        Located<DocumentNode> located = locator.locateApplicationSubtrees(root);

        assertThat(located.tier()).isEqualTo(LocatorTier.NAMESPACED_BLOCK);
        assertThat(located.items()).extracting(DocumentNode::toString)
            .containsExactly("<resource name=\"Inside\">");
        assertThat(diagnostics.eventsOfType(DiagnosticType.STRATEGY_ATTEMPTED)).hasSize(1);
    }

    @Test
    void locateApplicationSubtrees_noBlock_fallsBackToResources() {
        DocumentNode root = project("""
            <instances><configurations><configuration name="PLC">
              <resource name="App"><pou name="MAIN" pouType="program"/></resource>
            </configuration></configurations></instances>
            """);

        Located<DocumentNode> located = locator.locateApplicationSubtrees(root);

        assertThat(located.tier()).isEqualTo(LocatorTier.RESOURCE_SCAN);
        assertThat(diagnostics.eventsOfType(DiagnosticType.SECTION_NOT_FOUND))
            .extracting(event -> event.subject())
            .containsExactly(LocatorTier.NAMESPACED_BLOCK.id());
    }

    @Test
    void locateApplicationSubtrees_blockWithoutContent_isNotAccepted() {
        DocumentNode root = project("""
            <types><dataTypes><dataType name="T_Flat"><baseType><INT/></baseType></dataType></dataTypes></types>
            <addData><data name="%s"><folder name="Empty"/></data></addData>
            """.formatted(APPLICATION_BLOCK));

        Located<DocumentNode> located = locator.locateApplicationSubtrees(root);

        assertThat(located.tier()).isEqualTo(LocatorTier.RESOURCE_SCAN);
        assertThat(located.items()).extracting(DocumentNode::localName).containsExactly("types");
    }

    @Test
    void locateApplicationSubtrees_contentOnlyOutsideContainers_usesFlatScan() {
        DocumentNode root = project("""
            <instances><configurations><configuration name="PLC"><resource name="Bare"/></configuration></configurations></instances>
            <dataType name="T_Loose"><baseType><INT/></baseType></dataType>
            """);

        Located<DocumentNode> located = locator.locateApplicationSubtrees(root);

        assertThat(located.tier()).isEqualTo(LocatorTier.FLAT_SCAN);
        assertThat(located.items()).containsExactly(root);
    }

    @Test
    void locateApplicationSubtrees_emptyDocument_findsNothing() {
        DocumentNode root = project("<fileHeader/>");

        Located<DocumentNode> located = locator.locateApplicationSubtrees(root);

        assertThat(located.isFound()).isFalse();
        assertThat(located.items()).isEmpty();
        assertThat(diagnostics.eventsOfType(DiagnosticType.SECTION_NOT_FOUND)).hasSize(3);
    }

    @Test
    void locateGlobalVariableGroups_namesGroupsByAttributeOrResource() {
        DocumentNode root = project("""
            <instances><configurations><configuration name="PLC">
              <resource name="App">
                <globalVars name="GVL_Main"><variable name="a"/><variable name="b"/></globalVars>
                <globalVars><variable name="c"/></globalVars>
              </resource>
            </configuration></configurations></instances>
            """);

        Located<VariableGroup> located = locator.locateGlobalVariableGroups(root);

        assertThat(located.tier()).isEqualTo(LocatorTier.RESOURCE_SCAN);
        assertThat(located.items()).extracting(VariableGroup::name)
            .containsExactly("GVL_Main", "Global Variables - App");
        assertThat(located.items().get(0).variables()).hasSize(2);
    }

    @Test
    void locateGlobalVariableGroups_blockAndResource_usesBlockOnly() {
        DocumentNode root = project("""
            <instances><configurations><configuration name="PLC">
              <resource name="Outside">
                <globalVars name="GVL_Outside"><variable name="o"/></globalVars>
              </resource>
            </configuration></configurations></instances>
            <addData>
              <data name="%s">
                <resource name="Inside">
                  <globalVars name="GVL_Inside"><variable name="i"/></globalVars>
                </resource>
              </data>
            </addData>
            """.formatted(APPLICATION_BLOCK));

        Located<VariableGroup> located = locator.locateGlobalVariableGroups(root);

        assertThat(located.tier()).isEqualTo(LocatorTier.NAMESPACED_BLOCK);
        assertThat(located.items()).extracting(VariableGroup::name).containsExactly("GVL_Inside");
        assertThat(diagnostics.eventsOfType(DiagnosticType.STRATEGY_ATTEMPTED))
            .extracting(event -> event.subject())
            .containsExactly(LocatorTier.NAMESPACED_BLOCK.id());
    }

    @Test
    void locateGlobalVariableGroups_nestedVariables_areCollected() {
        DocumentNode root = project("""
            <globalVars name="GVL_Io">
              <variable name="bStart"/>
              <folder><variable name="bStop"/></folder>
            </globalVars>
            """);

        Located<VariableGroup> located = locator.locateGlobalVariableGroups(root);

        assertThat(located.items()).singleElement()
            .satisfies(group -> assertThat(group.variables())
                .extracting(DocumentNode::toString)
                .containsExactly("<variable name=\"bStart\">", "<variable name=\"bStop\">"));
    }

    @Test
    void locateGlobalVariableGroups_outsideResources_usesDefaultName() {
        DocumentNode root = project("<globalVars><variable name=\"x\"/></globalVars>");

        Located<VariableGroup> located = locator.locateGlobalVariableGroups(root);

        assertThat(located.tier()).isEqualTo(LocatorTier.FLAT_SCAN);
        assertThat(located.items()).extracting(VariableGroup::name)
            .containsExactly(StructureLocator.DEFAULT_GROUP_NAME);
    }

    @Test
    void locateDataTypeNodes_collectsEveryTierOnce() {
        DocumentNode root = project("""
            <types><dataTypes><dataType name="T_Types"/></dataTypes></types>
            <addData><data name="%s">
              <resource name="App"><dataType name="T_Block"/></resource>
            </data></addData>
            <dataType name="T_Loose"/>
            """.formatted(APPLICATION_BLOCK));

        List<DocumentNode> nodes = locator.locateDataTypeNodes(root);

        assertThat(nodes).extracting(node -> node.attribute("name").orElseThrow())
            .containsExactly("T_Block", "T_Types", "T_Loose");
    }

    @Test
    void locateUnionContainers_findsBothSpellings() {
        DocumentNode root = project("""
            <dataType name="U_A">
              <addData><data name="%1$s"><Union xmlns=""/></data></addData>
            </dataType>
            <addData><data name="%1$s"><union name="U_B"/></data></addData>
            """.formatted(UNION_BLOCK));

        List<DocumentNode> containers = locator.locateUnionContainers(root);

        assertThat(containers).extracting(DocumentNode::localName).containsExactly("Union", "union");
    }

    @Test
    void configuredBlockName_replacesDefault() {
        StructureLocator custom = new StructureLocator(
            query,
            new ExtractorConfig.NamespaceConfig("urn:vendor:app", null),
            diagnostics);
        DocumentNode root = project("""
            <addData><data name="urn:vendor:app"><pou name="MAIN"/></data></addData>
            """);

        Located<DocumentNode> located = custom.locateApplicationSubtrees(root);

        assertThat(located.tier()).isEqualTo(LocatorTier.NAMESPACED_BLOCK);
        assertThat(located.items()).extracting(DocumentNode::localName).containsExactly("data");
    }
}
