package my.telemetryranker.app.ranking;

import my.telemetryranker.app.model.AreaProfile;
import my.telemetryranker.app.model.DomainProfile;
import my.telemetryranker.app.model.MetricDomain;
import my.telemetryranker.app.model.Polarity;
import my.telemetryranker.app.model.RankingConfiguration;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Resolves whether lower or higher raw values are favorable for an area. Polarity comes from
 * configuration only: an explicitly registered area, or the domain's declared default.
 */
public class DirectionRegistry {
	private final RankingConfiguration configuration;

	public DirectionRegistry(RankingConfiguration configuration) {
		this.configuration = configuration;
	}

	public Polarity direction(MetricDomain domain, String areaId) {
		Polarity polarity = lookup(domain, areaId);
		if (polarity == null) {
			throw new RankingConfigurationException(missingMessage(domain, areaId));
		}
		return polarity;
	}

	/**
	 * Fails with every unregistered area at once so the whole input can be fixed in one pass.
	 */
	public void requireRegistered(MetricDomain domain, Collection<String> areaIds) {
		List<String> errors = new ArrayList<>();
		for (String areaId : new TreeSet<>(areaIds)) {
			if (lookup(domain, areaId) == null) {
				errors.add(missingMessage(domain, areaId));
			}
		}
		if (!errors.isEmpty()) {
			throw new RankingConfigurationException(errors);
		}
	}

	private Polarity lookup(MetricDomain domain, String areaId) {
		DomainProfile profile = configuration.domains().get(domain);
		if (profile == null) {
			return null;
		}
		AreaProfile area = profile.areas().get(areaId);
		if (area != null && area.polarity() != null) {
			return area.polarity();
		}
		return profile.defaultPolarity();
	}

	private String missingMessage(MetricDomain domain, String areaId) {
		return "No direction registered for area '" + areaId + "' in domain " + domain;
	}
}
