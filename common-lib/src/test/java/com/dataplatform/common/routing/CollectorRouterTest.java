package com.dataplatform.common.routing;

import com.dataplatform.common.model.AnalysisType;
import com.dataplatform.common.model.DataRequest;
import com.dataplatform.common.model.DataType;
import com.dataplatform.common.model.DateRange;
import com.dataplatform.common.model.FilterCriteria;
import com.dataplatform.common.model.ProviderCategory;
import com.dataplatform.common.model.ProviderDescriptor;
import com.dataplatform.common.model.ProviderScope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class CollectorRouterTest {

    private static ProviderDescriptor singleEntity() {
        return ProviderDescriptor.builder("single-entity")
            .category(ProviderCategory.GOVERNMENT)
            .supports(DataType.FUNDAMENTALS, DataType.FILINGS)
            .activationPredicate(ActivationPredicates.individualEntities())
            .priorityFn(PriorityFunctions.constant(90))
            .build();
    }

    private static ProviderDescriptor sectorOnly() {
        return ProviderDescriptor.builder("sector-only")
            .category(ProviderCategory.COMMERCIAL)
            .scope(ProviderScope.BULK)
            .supports(DataType.FUNDAMENTALS, DataType.SECTOR_SCREEN)
            .activationPredicate(ActivationPredicates.noExplicitEntities())
            .priorityFn(PriorityFunctions.boosted(50, Set.of(), 0, 0, 20))
            .build();
    }

    private final CollectorRouter router = new CollectorRouter();

    @Nested
    @DisplayName("route()")
    class Route {

        @Test
        @DisplayName("entityKeys=[AAPL] → only the single-entity provider")
        void singleEntityScenario() {
            DataRequest request = DataRequest.of(DataType.FUNDAMENTALS, "AAPL");
            RoutingDecision decision = router.route(request, List.of(singleEntity(), sectorOnly()));
            assertEquals(List.of("single-entity"), decision.providerIds());
        }

        @Test
        @DisplayName("sector filter without entities → only the sector provider")
        void sectorScenario() {
            DataRequest request = DataRequest.of(DataType.FUNDAMENTALS, List.of(),
                FilterCriteria.empty().withSector("Technology"));
            RoutingDecision decision = router.route(request, List.of(singleEntity(), sectorOnly()));
            assertEquals(List.of("sector-only"), decision.providerIds());
            assertEquals(70, decision.candidates().get(0).priority());
        }

        @Test
        @DisplayName("every candidate supports the data type and is active for the criteria")
        void competenceHolds() {
            List<ProviderDescriptor> catalog = List.of(singleEntity(), sectorOnly(),
                ProviderDescriptor.builder("realtime").supports(DataType.QUOTE)
                    .activationPredicate(ActivationPredicates.realTimeOnly()).build(),
                ProviderDescriptor.builder("delayed").supports(DataType.QUOTE, DataType.FUNDAMENTALS)
                    .activationPredicate(ActivationPredicates.notRealTime()).build());
            for (DataType type : DataType.values()) {
                for (int n : new int[] {0, 1, 20, 21}) {
                    for (boolean rt : new boolean[] {true, false}) {
                        List<String> keys = IntStream.range(0, n).mapToObj(i -> "E" + i).toList();
                        DataRequest request = DataRequest.of(type, keys, FilterCriteria.empty().withRealTime(rt));
                        for (RoutedProvider c : router.route(request, catalog).candidates()) {
                            assertTrue(c.provider().supports(type));
                            assertTrue(c.provider().isActiveFor(request.filterCriteria()));
                        }
                    }
                }
            }
        }

        @Test
        @DisplayName("ordering: priority desc, then reliability desc, then cost asc, then id")
        void totalOrder() {
            ProviderDescriptor cheap = ProviderDescriptor.builder("b-cheap").supports(DataType.QUOTE)
                .reliabilityScore(0.8).costPerRequest(0.01).priorityFn(PriorityFunctions.constant(10)).build();
            ProviderDescriptor pricey = ProviderDescriptor.builder("a-pricey").supports(DataType.QUOTE)
                .reliabilityScore(0.8).costPerRequest(0.05).priorityFn(PriorityFunctions.constant(10)).build();
            ProviderDescriptor reliable = ProviderDescriptor.builder("c-reliable").supports(DataType.QUOTE)
                .reliabilityScore(0.95).costPerRequest(0.10).priorityFn(PriorityFunctions.constant(10)).build();
            ProviderDescriptor top = ProviderDescriptor.builder("d-top").supports(DataType.QUOTE)
                .reliabilityScore(0.5).priorityFn(PriorityFunctions.constant(20)).build();
            ProviderDescriptor twin = ProviderDescriptor.builder("a-twin").supports(DataType.QUOTE)
                .reliabilityScore(0.8).costPerRequest(0.01).priorityFn(PriorityFunctions.constant(10)).build();

            RoutingDecision decision = router.route(DataRequest.of(DataType.QUOTE, "MSFT"),
                List.of(cheap, pricey, reliable, top, twin));

            assertEquals(List.of("d-top", "c-reliable", "a-twin", "b-cheap", "a-pricey"), decision.providerIds());
        }

        @Test
        @DisplayName("analysis-type specialty boosts priority")
        void analysisBoost() {
            ProviderDescriptor technical = ProviderDescriptor.builder("technical").supports(DataType.DAILY_SERIES)
                .priorityFn(PriorityFunctions.boosted(50, Set.of(AnalysisType.TECHNICAL), 30, 0, 0)).build();
            ProviderDescriptor generic = ProviderDescriptor.builder("generic").supports(DataType.DAILY_SERIES)
                .priorityFn(PriorityFunctions.constant(60)).build();

            DataRequest technicalReq = DataRequest.of(DataType.DAILY_SERIES, List.of("AAPL"),
                FilterCriteria.empty().withAnalysisType(AnalysisType.TECHNICAL));
            assertEquals("technical", router.route(technicalReq, List.of(generic, technical)).providerIds().get(0));
            assertEquals("generic", router.route(DataRequest.of(DataType.DAILY_SERIES, "AAPL"),
                List.of(generic, technical)).providerIds().get(0));
        }

        @Test
        @DisplayName("commercial provider over budget is excluded; government sources never are")
        void budgetGate() {
            CollectorRouter gated = new CollectorRouter(p -> false);
            ProviderDescriptor gov = singleEntity();
            ProviderDescriptor paid = ProviderDescriptor.builder("paid").supports(DataType.FUNDAMENTALS)
                .category(ProviderCategory.COMMERCIAL).build();

            RoutingDecision decision = gated.route(DataRequest.of(DataType.FUNDAMENTALS, "AAPL"), List.of(gov, paid));
            assertEquals(List.of("single-entity"), decision.providerIds());
        }

        @Test
        @DisplayName("no competent provider → empty decision")
        void unroutable() {
            RoutingDecision decision = router.route(DataRequest.of(DataType.OPTIONS, "AAPL"),
                List.of(singleEntity(), sectorOnly()));
            assertTrue(decision.isEmpty());
        }
    }

    @Nested
    @DisplayName("validate()")
    class Validate {

        @Test
        @DisplayName("more than 20 entities → warning, sector suggestion and first 10 entities")
        void tooManyEntities() {
            List<String> keys = IntStream.range(0, 25).mapToObj(i -> "T" + i).toList();
            ValidationResult result = router.validate(DataRequest.of(DataType.FUNDAMENTALS, keys, null),
                List.of(singleEntity(), sectorOnly()));

            assertFalse(result.valid());
            assertFalse(result.warnings().isEmpty());
            assertTrue(result.suggestedFilters().stream().anyMatch(s -> s.field().equals("sector")));
            ValidationResult.SuggestedFilter slice = result.suggestedFilters().stream()
                .filter(s -> s.field().equals("entityKeys")).findFirst().orElseThrow();
            assertEquals(keys.subList(0, 10), slice.suggestedValue());
        }

        @Test
        @DisplayName("inverted date range → invalid")
        void invertedRange() {
            DataRequest request = DataRequest.of(DataType.FUNDAMENTALS, List.of("AAPL"),
                FilterCriteria.empty().withDateRange(new DateRange(LocalDate.of(2024, 5, 1), LocalDate.of(2024, 1, 1))));
            ValidationResult result = router.validate(request, List.of(singleEntity()));
            assertFalse(result.valid());
        }

        @Test
        @DisplayName("entity-level type without entities or sector → warning with sector suggestion")
        void missingScope() {
            ValidationResult result = router.validate(DataRequest.of(DataType.FILINGS),
                List.of(ProviderDescriptor.builder("any").supports(DataType.FILINGS).build()));
            assertTrue(result.valid());
            assertEquals(1, result.warnings().size());
            assertEquals("sector", result.suggestedFilters().get(0).field());
        }

        @Test
        @DisplayName("real-time request only delayed providers serve → warning suggesting realTime=false")
        void realTimeUnavailable() {
            ProviderDescriptor delayed = ProviderDescriptor.builder("delayed").supports(DataType.QUOTE)
                .activationPredicate(ActivationPredicates.notRealTime()).build();
            ValidationResult result = router.validate(DataRequest.of(DataType.QUOTE, List.of("AAPL"),
                FilterCriteria.empty().withRealTime(true)), List.of(delayed));

            assertFalse(result.valid());
            assertTrue(result.suggestedFilters().stream()
                .anyMatch(s -> s.field().equals("realTime") && Boolean.FALSE.equals(s.suggestedValue())));
        }

        @Test
        @DisplayName("well-formed request → valid with no warnings")
        void clean() {
            ValidationResult result = router.validate(DataRequest.of(DataType.FUNDAMENTALS, "AAPL"),
                List.of(singleEntity()));
            assertTrue(result.valid());
            assertTrue(result.warnings().isEmpty());
        }
    }
}
