package io.mersel.services.xbrl.web.controllers;

import io.mersel.services.xbrl.application.interfaces.IXbrlGenerator;
import io.mersel.services.xbrl.application.interfaces.IXbrlParser;
import io.mersel.services.xbrl.application.interfaces.IXbrlTemplateFactory;
import io.mersel.services.xbrl.application.interfaces.IXbrlValidator;
import io.mersel.services.xbrl.application.interfaces.XbrlParseException;
import io.mersel.services.xbrl.application.models.xbrl.TaxonomyConcept;
import io.mersel.services.xbrl.application.models.xbrl.XbrlContext;
import io.mersel.services.xbrl.application.models.xbrl.XbrlFact;
import io.mersel.services.xbrl.application.models.xbrl.XbrlInstance;
import io.mersel.services.xbrl.application.models.xbrl.XbrlPeriod;
import io.mersel.services.xbrl.application.models.xbrl.XbrlTaxonomy;
import io.mersel.services.xbrl.application.models.xbrl.XbrlTemplate;
import io.mersel.services.xbrl.application.models.xbrl.XbrlValidationResult;
import io.mersel.services.xbrl.web.infrastructure.GlobalExceptionHandler;
import io.mersel.services.xbrl.web.infrastructure.XbrlHeaders;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * XbrlController birim testleri.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("XbrlController")
class XbrlControllerTest {

    private MockMvc mockMvc;

    @Mock
    private IXbrlParser xbrlParser;

    @Mock
    private IXbrlTemplateFactory templateFactory;

    @Mock
    private IXbrlValidator xbrlValidator;

    @Mock
    private IXbrlGenerator xbrlGenerator;

    @InjectMocks
    private XbrlController xbrlController;

    private final MockMultipartFile instanceFile = new MockMultipartFile(
            "instance", "report.xbrl", "application/xml", "<xbrli:xbrl/>".getBytes());
    private final MockMultipartFile taxonomyFile = new MockMultipartFile(
            "taxonomy", "fin.xsd", "application/xml", "<xs:schema/>".getBytes());

    @BeforeEach
    void setUp() throws Exception {
        var sizeField = XbrlController.class.getDeclaredField("maxDocumentSizeMb");
        sizeField.setAccessible(true);
        sizeField.setInt(xbrlController, 50);

        mockMvc = MockMvcBuilders.standaloneSetup(xbrlController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static XbrlInstance sampleInstance() {
        return new XbrlInstance("fin.xsd",
                List.of(new XbrlContext("C1", "0001", XbrlPeriod.instant("2024-12-31"))),
                List.of(),
                List.of(new XbrlFact("CompanyName", "string", "instant", "Mersel", null, "C1", null, null)),
                null);
    }

    @Nested
    @DisplayName("POST /v1/xbrl/parse")
    class Parse {

        @Test
        @DisplayName("instance modelini dönmeli")
        void shouldReturnParsedInstance() throws Exception {
            when(xbrlParser.parseInstance(any(byte[].class))).thenReturn(sampleInstance());

            mockMvc.perform(multipart("/v1/xbrl/parse").file(instanceFile))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.result.schemaRef").value("fin.xsd"))
                    .andExpect(jsonPath("$.result.contexts[0].period.instant").value("2024-12-31"))
                    .andExpect(jsonPath("$.result.facts[0].value").value("Mersel"));
        }

        @Test
        @DisplayName("bozuk belge 422 dönmeli")
        void shouldReturnUnprocessableForMalformedXml() throws Exception {
            when(xbrlParser.parseInstance(any(byte[].class)))
                    .thenThrow(new XbrlParseException("XBRL belgesi ayrıştırılamadı: satır 1"));

            mockMvc.perform(multipart("/v1/xbrl/parse").file(instanceFile))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.title").value("Ayrıştırma Başarısız"))
                    .andExpect(jsonPath("$.detail").value("XBRL belgesi ayrıştırılamadı: satır 1"));
        }

        @Test
        @DisplayName("instance parçası yoksa BadRequest dönmeli")
        void shouldReturnBadRequestWithoutInstance() throws Exception {
            mockMvc.perform(multipart("/v1/xbrl/parse").file(taxonomyFile))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.errorMessage").value("Instance belgesi boş olamaz"));

            verifyNoInteractions(xbrlParser);
        }
    }

    @Nested
    @DisplayName("POST /v1/xbrl/template ve /v1/xbrl/validate")
    class TemplateAndValidate {

        private final XbrlTaxonomy taxonomy = new XbrlTaxonomy(List.of(
                new TaxonomyConcept("CompanyName", "string", "Company Name", null, false, "instant", null)),
                List.of());
        private final XbrlTemplate template = new XbrlTemplate(taxonomy, List.of("CompanyName"), List.of(),
                List.of("quarterly", "annual"), List.of("USD"));

        @Test
        @DisplayName("şablonu zorunlu kavramlarla dönmeli")
        void shouldReturnTemplate() throws Exception {
            when(xbrlParser.parseTaxonomy(any(byte[].class))).thenReturn(taxonomy);
            when(templateFactory.createTemplate(taxonomy)).thenReturn(template);

            mockMvc.perform(multipart("/v1/xbrl/template").file(taxonomyFile))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.result.requiredConcepts[0]").value("CompanyName"))
                    .andExpect(jsonPath("$.result.reportingPeriods.length()").value(2));
        }

        @Test
        @DisplayName("denetim bulgularını dönmeli")
        void shouldReturnValidationResult() throws Exception {
            var instance = sampleInstance();
            when(xbrlParser.parseInstance(any(byte[].class))).thenReturn(instance);
            when(xbrlParser.parseTaxonomy(any(byte[].class))).thenReturn(taxonomy);
            when(templateFactory.createTemplate(taxonomy)).thenReturn(template);
            when(xbrlValidator.validate(instance, template)).thenReturn(
                    XbrlValidationResult.of(List.of("Zorunlu kavram eksik: Revenue"), List.of()));

            mockMvc.perform(multipart("/v1/xbrl/validate").file(instanceFile).file(taxonomyFile))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.result.valid").value(false))
                    .andExpect(jsonPath("$.result.errors[0]").value("Zorunlu kavram eksik: Revenue"));
        }

        @Test
        @DisplayName("taksonomi parçası yoksa BadRequest dönmeli")
        void shouldRequireTaxonomyForValidation() throws Exception {
            mockMvc.perform(multipart("/v1/xbrl/validate").file(instanceFile))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.errorMessage").value("Taksonomi şeması boş olamaz"));

            verifyNoInteractions(xbrlParser, xbrlValidator);
        }
    }

    @Nested
    @DisplayName("POST /v1/xbrl/generate")
    class Generate {

        @Test
        @DisplayName("JSON modelden XML üretmeli")
        void shouldGenerateXmlFromJson() throws Exception {
            byte[] xml = "<xbrli:xbrl/>".getBytes(StandardCharsets.UTF_8);
            when(xbrlGenerator.generate(any(XbrlInstance.class))).thenReturn(xml);

            mockMvc.perform(post("/v1/xbrl/generate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {
                                      "schemaRef": "fin.xsd",
                                      "contexts": [{"id": "C1", "entity": "0001",
                                                    "period": {"startDate": "2024-01-01", "endDate": "2024-12-31"}}],
                                      "units": [{"id": "U1", "measure": "iso4217:USD"}],
                                      "facts": [{"name": "Revenue", "type": "monetary", "period": "duration",
                                                 "value": "1200", "unit": "U1", "context": "C1", "decimals": 2}]
                                    }
                                    """))
                    .andExpect(status().isOk())
                    .andExpect(content().contentType(MediaType.APPLICATION_XML))
                    .andExpect(header().string(XbrlHeaders.FACT_COUNT, "1"))
                    .andExpect(content().bytes(xml));

            ArgumentCaptor<XbrlInstance> captor = ArgumentCaptor.forClass(XbrlInstance.class);
            verify(xbrlGenerator).generate(captor.capture());
            XbrlInstance instance = captor.getValue();
            assertThat(instance.contexts().get(0).period())
                    .isEqualTo(XbrlPeriod.duration("2024-01-01", "2024-12-31"));
            assertThat(instance.facts().get(0).decimals()).isEqualTo(2);
            assertThat(instance.metadata()).isNotNull();
        }
    }
}
