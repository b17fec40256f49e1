package com.mk.fx.qa.llm.load.resource;

import com.mk.fx.qa.llm.load.cfg.LoadRunCfg;
import com.mk.fx.qa.llm.load.dto.controllerresponse.RunConfigRequest;
import com.mk.fx.qa.llm.load.dto.controllerresponse.RunDefaultsResponse;
import com.mk.fx.qa.llm.load.model.RunConfig;
import org.mapstruct.BeanMapping;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;
import org.mapstruct.Named;
import org.mapstruct.NullValueCheckStrategy;
import org.mapstruct.NullValuePropertyMappingStrategy;

@Mapper(componentModel = "spring")
public interface RunConfigMapper {

  String MASKED_CREDENTIAL = "****";

  LoadRunCfg.Defaults copy(LoadRunCfg.Defaults defaults);

  /** Copies every non-null request field onto {@code target}. */
  @BeanMapping(
      nullValuePropertyMappingStrategy = NullValuePropertyMappingStrategy.IGNORE,
      nullValueCheckStrategy = NullValueCheckStrategy.ALWAYS)
  void overlay(RunConfigRequest request, @MappingTarget LoadRunCfg.Defaults target);

  /** Builds and validates the run configuration. */
  RunConfig toRunConfig(LoadRunCfg.Defaults values);

  @Mapping(target = "apiKey", source = "apiKey", qualifiedByName = "maskCredential")
  RunDefaultsResponse toDefaultsResponse(LoadRunCfg.Defaults defaults);

  /**
   * Fills the gaps of {@code request} from {@code defaults}.
   *
   * @throws com.mk.fx.qa.llm.load.exceptions.RunConfigValidationException if the result is invalid
   */
  default RunConfig merge(RunConfigRequest request, LoadRunCfg.Defaults defaults) {
    var values = copy(defaults);
    if (request != null) {
      overlay(request, values);
    }
    return toRunConfig(values);
  }

  @Named("maskCredential")
  default String maskCredential(String apiKey) {
    return apiKey == null || apiKey.isBlank() ? "" : MASKED_CREDENTIAL;
  }
}
