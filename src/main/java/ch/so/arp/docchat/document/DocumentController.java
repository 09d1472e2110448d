package ch.so.arp.docchat.document;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import ch.so.arp.docchat.error.ValidationException;
import jakarta.validation.Valid;

/**
 * REST endpoints to ingest, inspect and delete documents.
 */
@RestController
@RequestMapping(path = "/api/documents", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class DocumentController {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentController.class);

    private final IngestionService ingestionService;

    public DocumentController(IngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public IngestionResult ingest(@Valid @RequestBody IngestionRequest request) {
        return ingestionService.ingest(request);
    }

    @PostMapping(path = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public IngestionResult upload(@RequestParam("file") MultipartFile file, @RequestParam("category") String category) {
        if (file == null || file.isEmpty()) {
            throw new ValidationException("No file uploaded");
        }
        MediaType contentType = parseContentType(file.getContentType());
        if (MediaType.APPLICATION_PDF.isCompatibleWith(contentType)) {
            throw new ValidationException("PDF files are not supported, please upload plain text files");
        }
        if (!MediaType.TEXT_PLAIN.isCompatibleWith(contentType)) {
            throw new ValidationException("Unsupported file type " + contentType + ", please upload plain text files");
        }
        String fileName = StringUtils.hasText(file.getOriginalFilename()) ? file.getOriginalFilename() : "upload.txt";
        String content;
        try {
            content = new String(file.getBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            LOGGER.warn("Unable to read uploaded file {}", fileName, ex);
            throw new ValidationException("Unable to read uploaded file " + fileName, ex);
        }
        String title = StringUtils.stripFilenameExtension(StringUtils.getFilename(fileName));
        return ingestionService.ingest(new IngestionRequest(title, content, category, fileName, null));
    }

    @PostMapping(path = "/save", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public IngestionResult save(@Valid @RequestBody SaveDocumentRequest request) {
        return ingestionService.saveGenerated(request.title(), request.content(), request.category());
    }

    @GetMapping
    public List<Document> list() {
        return ingestionService.listDocuments();
    }

    @GetMapping("/{id}")
    public Document get(@PathVariable("id") String id) {
        return ingestionService.getDocument(id);
    }

    @GetMapping("/{id}/chunks")
    public List<ChunkView> chunks(@PathVariable("id") String id) {
        return ingestionService.getChunks(id).stream().map(ChunkView::of).toList();
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable("id") String id) {
        ingestionService.delete(id);
    }

    private static MediaType parseContentType(String contentType) {
        if (!StringUtils.hasText(contentType)) {
            return MediaType.APPLICATION_OCTET_STREAM;
        }
        try {
            return MediaType.parseMediaType(contentType);
        } catch (org.springframework.http.InvalidMediaTypeException ex) {
            throw new ValidationException("Invalid content type " + contentType, ex);
        }
    }
}
