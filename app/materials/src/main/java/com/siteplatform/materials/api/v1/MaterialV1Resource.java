package com.siteplatform.materials.api.v1;

import com.siteplatform.common.dispatch.CodecBackedResource;
import com.siteplatform.common.version.ApiVersion;
import com.siteplatform.materials.model.Material;
import com.siteplatform.materials.service.MaterialService;
import org.springframework.stereotype.Component;

@Component
public class MaterialV1Resource extends CodecBackedResource<Material, MaterialV1Dto> {

  public static final String RESOURCE = "materials";
  public static final ApiVersion VERSION = new ApiVersion(1, 0);

  public MaterialV1Resource(MaterialV1Codec codec, MaterialService materialService) {
    super(RESOURCE, VERSION, MaterialV1Dto.class, codec, materialService);
  }
}
