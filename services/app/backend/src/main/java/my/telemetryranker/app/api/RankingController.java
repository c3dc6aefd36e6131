package my.telemetryranker.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.telemetryranker.app.dto.AnalyzeRequestDto;
import my.telemetryranker.app.dto.ComparisonRequestDto;
import my.telemetryranker.app.dto.ComparisonResponseDto;
import my.telemetryranker.app.dto.RankingConfigurationDto;
import my.telemetryranker.app.dto.RankingRequestDto;
import my.telemetryranker.app.dto.RankingResponseDto;
import my.telemetryranker.app.dto.RankingStatisticsDto;
import my.telemetryranker.app.dto.UnifiedRankingRequestDto;
import my.telemetryranker.app.dto.UnifiedRankingResponseDto;
import my.telemetryranker.app.model.MetricDomain;
import my.telemetryranker.app.model.MetricRecord;
import my.telemetryranker.app.report.RankingCsvWriter;
import my.telemetryranker.app.service.CsvRankingOutcome;
import my.telemetryranker.app.service.RankingService;
import my.telemetryranker.app.service.UnifiedRanking;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/rankings")
@Tag(name = "Rankings")
public class RankingController {
	private final RankingService rankingService;

	public RankingController(RankingService rankingService) {
		this.rankingService = rankingService;
	}

	@GetMapping("/configuration")
	@Operation(summary = "Show the effective ranking configuration")
	public RankingConfigurationDto configuration() {
		return RankingDtoMapper.toConfiguration(rankingService.configuration());
	}

	@PostMapping("/{domain}")
	@Operation(summary = "Rank the entities of a domain from daily records")
	public RankingResponseDto rank(@PathVariable String domain,
								   @Valid @RequestBody RankingRequestDto request) {
		MetricDomain metricDomain = MetricDomain.parse(domain);
		return RankingDtoMapper.toResponse(
				rankingService.rank(metricDomain, RankingDtoMapper.toRecords(request.records())), 0);
	}

	@PostMapping(path = "/{domain}/csv", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
	@Operation(summary = "Rank the entities of a domain from an uploaded CSV file")
	public RankingResponseDto rankCsv(@PathVariable String domain,
									  @RequestParam("file") MultipartFile file) throws IOException {
		MetricDomain metricDomain = MetricDomain.parse(domain);
		CsvRankingOutcome outcome = rankingService.rankCsv(metricDomain, file.getBytes(), file.getOriginalFilename());
		return RankingDtoMapper.toResponse(outcome.result(), outcome.skippedRows());
	}

	@PostMapping("/compare")
	@Operation(summary = "Compare the score distributions of two rankings")
	public ComparisonResponseDto compare(@Valid @RequestBody ComparisonRequestDto request) {
		return RankingDtoMapper.toComparison(rankingService.compare(
				request.left().label(), RankingDtoMapper.toEntries(request.left()),
				request.right().label(), RankingDtoMapper.toEntries(request.right())));
	}

	@PostMapping(path = "/compare/csv", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
	@Operation(summary = "Compare two exported composite ranking tables")
	public ComparisonResponseDto compareCsv(@RequestParam("left") MultipartFile left,
											@RequestParam("right") MultipartFile right) throws IOException {
		return RankingDtoMapper.toComparison(rankingService.compareExports(
				label(left, "left"), left.getBytes(), label(right, "right"), right.getBytes()));
	}

	@PostMapping("/unified")
	@Operation(summary = "Rank CP and HDD records and merge them into one cross-domain ranking")
	public UnifiedRankingResponseDto unified(@Valid @RequestBody UnifiedRankingRequestDto request) {
		Map<MetricDomain, List<MetricRecord>> records = new EnumMap<>(MetricDomain.class);
		records.put(MetricDomain.CP, RankingDtoMapper.toRecords(request.cpRecords()));
		records.put(MetricDomain.HDD, RankingDtoMapper.toRecords(request.hddRecords()));
		UnifiedRanking unified = rankingService.unify(records);
		String runTimestamp = unified.domainResults().isEmpty()
				? null
				: RankingCsvWriter.formatTimestamp(unified.domainResults().get(0).runTimestamp());
		return new UnifiedRankingResponseDto(
				runTimestamp,
				unified.ranking().stream().map(RankingDtoMapper::toUnified).toList(),
				unified.domainResults().stream().map(result -> RankingDtoMapper.toResponse(result, 0)).toList()
		);
	}

	@PostMapping("/analyze")
	@Operation(summary = "Describe the score distribution of one ranking")
	public RankingStatisticsDto analyze(@Valid @RequestBody AnalyzeRequestDto request) {
		return RankingDtoMapper.toStatistics(rankingService.analyze(
				request.ranking().label(), RankingDtoMapper.toEntries(request.ranking()), request.topN()));
	}

	private static String label(MultipartFile file, String fallback) {
		String name = file.getOriginalFilename();
		if (name == null || name.isBlank()) {
			return fallback;
		}
		int dot = name.lastIndexOf('.');
		return dot > 0 ? name.substring(0, dot) : name;
	}
}
