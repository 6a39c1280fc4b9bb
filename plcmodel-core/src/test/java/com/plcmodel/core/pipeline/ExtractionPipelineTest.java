package com.plcmodel.core.pipeline;

import com.plcmodel.core.config.ExtractorConfig;
import com.plcmodel.core.diagnostics.DiagnosticEvent;
import com.plcmodel.core.diagnostics.DiagnosticLog;
import com.plcmodel.core.diagnostics.DiagnosticType;
import com.plcmodel.core.document.DocumentNode;
import com.plcmodel.core.document.DocumentTestBase;
import com.plcmodel.core.document.StructuralFailureException;
import com.plcmodel.core.locator.LocatorTier;
import com.plcmodel.core.model.CanonicalModel;
import com.plcmodel.core.model.EnumRecord;
import com.plcmodel.core.model.ExportType;
import com.plcmodel.core.model.StructureRecord;
import com.plcmodel.core.model.TaskRecord;
import com.plcmodel.core.model.VariableRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link ExtractionPipeline}.
 */
class ExtractionPipelineTest extends DocumentTestBase {

    private static final String POINT_AND_COLOR = """
        <dataType name="ST_Point">
          <baseType><struct>
            <variable name="x"><type><INT/></type></variable>
            <variable name="y"><type><INT/></type></variable>
          </struct></baseType>
        </dataType>
        <dataType name="E_Color">
          <baseType><enum><values>
            <value name="Red" value="0"/>
            <value name="Green" value="1"/>
            <value name="Blue" value="2"/>
          </values></enum></baseType>
        </dataType>
        """;

    private ExtractionPipeline pipeline;
    private DiagnosticLog diagnostics;

    @BeforeEach
    void setUp() {
        pipeline = new ExtractionPipeline(ExtractorConfig.defaults());
        diagnostics = new DiagnosticLog();
    }

    @Test
    void extract_applicationBlock_classifiesStructureAndEnum() {
        CanonicalModel model = extract(applicationBlock("<resource name=\"App\">" + POINT_AND_COLOR + "</resource>"));

        assertThat(model.structures()).singleElement()
            .satisfies(structure -> assertThat(structure.members()).hasSize(2));
        assertThat(model.enums()).singleElement()
            .satisfies(enumRecord -> assertThat(enumRecord.values()).hasSize(3));
        assertThat(model.dataTypes()).isEmpty();
    }

    @Test
    void extract_resourcesWithoutBlock_matchesBlockResult() {
        CanonicalModel viaBlock = extract(applicationBlock("<resource name=\"App\">" + POINT_AND_COLOR + "</resource>"));
        CanonicalModel viaResource = extract(project("""
            <instances><configurations><configuration name="PLC">
              <resource name="App">%s</resource>
            </configuration></configurations></instances>
            """.formatted(POINT_AND_COLOR)));

        assertThat(viaResource.structures()).isEqualTo(viaBlock.structures());
        assertThat(viaResource.enums()).isEqualTo(viaBlock.enums());
        assertThat(viaResource.dataTypes()).isEqualTo(viaBlock.dataTypes());
        assertThat(diagnostics.eventsOfType(DiagnosticType.SECTION_LOCATED))
            .extracting(DiagnosticEvent::subject)
            .contains(LocatorTier.RESOURCE_SCAN.id());
    }

    @Test
    void extract_sameVariableNameInTwoGroups_keepsBoth() {
        CanonicalModel model = extract(project("""
            <instances><configurations><configuration name="PLC">
              <resource name="App">
                <globalVars name="GVL_A"><variable name="Counter"><type><INT/></type></variable></globalVars>
                <globalVars name="GVL_B"><variable name="Counter"><type><DINT/></type></variable></globalVars>
              </resource>
            </configuration></configurations></instances>
            """));

        assertThat(model.globalVariables())
            .extracting(VariableRecord::name, VariableRecord::groupName, VariableRecord::type, VariableRecord::origin)
            .containsExactly(
                tuple("Counter", "GVL_A", "INT", "resource-scan"),
                tuple("Counter", "GVL_B", "DINT", "resource-scan")
            );
    }

    @Test
    void extract_globalsInsideAndOutsideBlock_keepsOnlyBlockGroup() {
        CanonicalModel model = extract(project("""
            <instances><configurations><configuration name="PLC">
              <resource name="Device">
                <globalVars name="GVL_Device"><variable name="gDevice"><type><INT/></type></variable></globalVars>
              </resource>
            </configuration></configurations></instances>
            <addData>
              <data name="%s">
                <resource name="Application">
                  <globalVars name="GVL_App"><variable name="gApp"><type><BOOL/></type></variable></globalVars>
                </resource>
              </data>
            </addData>
            """.formatted(APPLICATION_BLOCK)));

        assertThat(model.globalVariables())
            .extracting(VariableRecord::name, VariableRecord::groupName, VariableRecord::origin)
            .containsExactly(tuple("gApp", "GVL_App", LocatorTier.NAMESPACED_BLOCK.id()));
    }

    @Test
    void extract_unnamedDataType_isRejectedOnceAndEmitsNothing() {
        CanonicalModel model = extract(applicationBlock("""
            <resource name="App">
              <dataType><baseType><INT/></baseType></dataType>
            </resource>
            """));

        assertThat(model.summary().totalItems()).isZero();
        assertThat(diagnostics.eventsOfType(DiagnosticType.RECORD_REJECTED)).hasSize(1);
    }

    @Test
    void extract_unionAndStructureWithSameName_keepsUnion() {
        CanonicalModel model = extract(applicationBlock("""
            <resource name="App">
              <addData><data name="%s">
                <union name="Packed">
                  <variable name="raw"><type><DWORD/></type></variable>
                  <variable name="value"><type><REAL/></type></variable>
                </union>
              </data></addData>
              <dataType name="Packed">
                <baseType><struct>
                  <variable name="a"><type><INT/></type></variable>
                  <variable name="b"><type><INT/></type></variable>
                </struct></baseType>
              </dataType>
            </resource>
            """.formatted(UNION_BLOCK)));

        assertThat(model.unions()).singleElement()
            .satisfies(union -> assertThat(union.name()).isEqualTo("Packed"));
        assertThat(model.structures()).isEmpty();
        assertThat(diagnostics.eventsOfType(DiagnosticType.DUPLICATE_IGNORED))
            .extracting(DiagnosticEvent::subject)
            .containsExactly("Packed");
    }

    @Test
    void extract_markerUnion_isNotAlsoAStructure() {
        CanonicalModel model = extract(applicationBlock("""
            <resource name="App">
              <dataType name="U_Word">
                <baseType><struct>
                  <variable name="w"><type><WORD/></type></variable>
                  <variable name="b"><type><BYTE/></type></variable>
                </struct></baseType>
                <addData><data name="%s"><Union xmlns=""/></data></addData>
              </dataType>
            </resource>
            """.formatted(UNION_BLOCK)));

        assertThat(model.unions()).extracting(union -> union.name()).containsExactly("U_Word");
        assertThat(model.structures()).isEmpty();
    }

    @Test
    void extract_duplicateNamesAcrossSections_firstDiscoveredWins() {
        CanonicalModel model = extract(project("""
            <types><dataTypes>
              <dataType name="T_Dup"><baseType><INT/></baseType></dataType>
            </dataTypes></types>
            <addData><data name="%s"><resource name="App">
              <dataType name="T_Dup"><baseType><REAL/></baseType></dataType>
              <pou name="MAIN" pouType="program"/>
              <pou name="MAIN" pouType="function"/>
            </resource></data></addData>
            """.formatted(APPLICATION_BLOCK)));

        assertThat(model.dataTypes()).singleElement()
            .satisfies(type -> assertThat(type.details()).containsEntry("baseType", "REAL"));
        assertThat(model.programUnits()).singleElement()
            .satisfies(unit -> assertThat(unit.pouType()).isEqualTo("program"));
    }

    @Test
    void extract_typesOutsideApplicationContent_areStillClassified() {
        CanonicalModel model = extract(project("""
            <types><dataTypes>
              <dataType name="E_Outside"><baseType><enum><values><value name="A"/></values></enum></baseType></dataType>
            </dataTypes></types>
            <addData><data name="%s"><resource name="App">
              <dataType name="ST_Inside"><baseType><struct><variable name="v"/></struct></baseType></dataType>
            </resource></data></addData>
            """.formatted(APPLICATION_BLOCK)));

        assertThat(model.structures()).extracting(StructureRecord::name).containsExactly("ST_Inside");
        assertThat(model.enums()).extracting(EnumRecord::name).containsExactly("E_Outside");
    }

    @Test
    void extract_preservesDocumentOrder() {
        CanonicalModel model = extract(applicationBlock("""
            <resource name="App">
              <dataType name="ST_C"><baseType><struct><variable name="c"/></struct></baseType></dataType>
              <dataType name="ST_A"><baseType><struct><variable name="a"/></struct></baseType></dataType>
              <dataType name="ST_B"><baseType><struct><variable name="b"/></struct></baseType></dataType>
              <globalVars name="GVL">
                <variable name="z"/><variable name="m"/><variable name="a"/>
              </globalVars>
            </resource>
            """));

        assertThat(model.structures()).extracting(StructureRecord::name).containsExactly("ST_C", "ST_A", "ST_B");
        assertThat(model.globalVariables()).extracting(VariableRecord::name).containsExactly("z", "m", "a");
    }

    @Test
    void extract_twice_yieldsEqualModels() {
        DocumentNode root = applicationBlock("""
            <resource name="App">%s
              <globalVars name="GVL"><variable name="g"><type><BOOL/></type></variable></globalVars>
              <pou name="MAIN" pouType="program"/>
            </resource>
            """.formatted(POINT_AND_COLOR));

        CanonicalModel first = pipeline.extract(root);
        CanonicalModel second = pipeline.extract(root);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void extract_reportsCollectionCounts() {
        extract(applicationBlock("<resource name=\"App\">" + POINT_AND_COLOR + "</resource>"));

        assertThat(diagnostics.eventsOfType(DiagnosticType.COLLECTION_COUNT))
            .extracting(DiagnosticEvent::concern, DiagnosticEvent::detail)
            .containsExactly(
                tuple("DataTypes", "0"),
                tuple("POUs", "0"),
                tuple("GlobalVariables", "0"),
                tuple("Enums", "1"),
                tuple("Unions", "0"),
                tuple("Structures", "1")
            );
    }

    @Test
    void extract_emptyDocument_returnsEmptyModel() {
        CanonicalModel model = extract(project("<fileHeader companyName=\"ACME\"/>"));

        assertThat(model.isEmpty()).isTrue();
        assertThat(model.projectInfo().exportType()).isEqualTo(ExportType.PROJECT);
    }

    @Test
    void extract_nullRoot_throwsStructuralFailure() {
        assertThatThrownBy(() -> pipeline.extract(null))
            .isInstanceOf(StructuralFailureException.class);
    }

    @Test
    void projectInfo_readsConfigurationAndResource() {
        DocumentNode root = parse("""
            <library xmlns="http://www.plcopen.org/xml/tc6_0200">
              <configuration name="Device"><resource name="Application"/></configuration>
            </library>
            """);

        CanonicalModel model = extract(root);

        assertThat(model.projectInfo().exportType()).isEqualTo(ExportType.LIBRARY);
        assertThat(model.projectInfo().configurationName()).isEqualTo("Device");
        assertThat(model.projectInfo().resourceName()).isEqualTo("Application");
    }

    @Test
    void projectInfo_readsTasksOfAllResources() {
        DocumentNode root = project("""
            <instances><configurations><configuration name="PLC">
              <resource name="Res1">
                <task name="Fast" interval="T#1ms" priority="0">
                  <pouInstance name="fbFast" typeName="FB_Fast"/>
                  <pouInstance name="PLC_PRG"/>
                </task>
                <task priority="9"/>
              </resource>
              <resource name="Res2">
                <task name="Event" priority="3"/>
              </resource>
            </configuration></configurations></instances>
            """);

        CanonicalModel model = extract(root);

        assertThat(model.projectInfo().tasks())
            .extracting(TaskRecord::name, TaskRecord::interval, TaskRecord::programUnits)
            .containsExactly(
                tuple("Fast", "T#1ms", List.of("FB_Fast", "PLC_PRG")),
                tuple("Event", null, List.of())
            );
    }

    @Test
    void projectInfo_unknownRootWithResource_isResourceBased() {
        DocumentNode root = parse("<export><resource name=\"Res\"/></export>");

        assertThat(extract(root).projectInfo().exportType()).isEqualTo(ExportType.RESOURCE_BASED);
    }

    private CanonicalModel extract(DocumentNode root) {
        return pipeline.extract(root, "test.xml", diagnostics);
    }
}
